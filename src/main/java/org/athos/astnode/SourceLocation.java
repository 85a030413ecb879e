package org.athos.astnode;

/**
 * A file/line coordinate attached to every node.
 * <p>
 * Synthetic nodes reuse the coordinate of the construct they were derived
 * from, optionally with a tag (for example {@code END}), so two distinct
 * nodes may share the same printed location.
 */
public final class SourceLocation {
    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, null);

    public final String fileName;
    public final int line;
    public final String tag;

    public SourceLocation(String fileName, int line) {
        this(fileName, line, null);
    }

    public SourceLocation(String fileName, int line, String tag) {
        this.fileName = fileName;
        this.line = line;
        this.tag = tag;
    }

    /**
     * Returns a copy of this location carrying the given tag.
     *
     * @param tag the tag, e.g. "START" or "END"
     * @return a new location with the same file and line
     */
    public SourceLocation withTag(String tag) {
        return new SourceLocation(fileName, line, tag);
    }

    @Override
    public String toString() {
        String text = fileName + ":" + line;
        return tag == null ? text : text + ":" + tag;
    }
}
