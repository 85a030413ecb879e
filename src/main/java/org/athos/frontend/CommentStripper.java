package org.athos.frontend;

/**
 * Removes C comments from source text.
 * <p>
 * Both {@code //} and {@code /* *}{@code /} comments are removed; comment
 * markers inside string and character literals are kept. Newlines inside
 * block comments are kept so that line numbers reported by the parser still
 * match the original file.
 */
public final class CommentStripper {

    private CommentStripper() {
    }

    public static String strip(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        int length = text.length();
        int position = 0;
        while (position < length) {
            char c = text.charAt(position);
            char next = position + 1 < length ? text.charAt(position + 1) : '\0';

            if (c == '"' || c == '\'') {
                position = copyLiteral(text, position, sb);
            } else if (c == '/' && next == '/') {
                // Line comment: the newline itself stays
                while (position < length && text.charAt(position) != '\n') {
                    position++;
                }
            } else if (c == '/' && next == '*') {
                position += 2;
                while (position < length && !(text.charAt(position) == '*'
                        && position + 1 < length && text.charAt(position + 1) == '/')) {
                    if (text.charAt(position) == '\n') {
                        sb.append('\n');
                    }
                    position++;
                }
                position = Math.min(length, position + 2);
            } else {
                sb.append(c);
                position++;
            }
        }
        return sb.toString();
    }

    /**
     * Copies a string or character literal starting at {@code start},
     * escapes included, and returns the position after it.
     */
    private static int copyLiteral(String text, int start, StringBuilder sb) {
        char quote = text.charAt(start);
        int position = start + 1;
        while (position < text.length()) {
            char c = text.charAt(position);
            if (c == '\\' && position + 1 < text.length()) {
                position += 2;
                continue;
            }
            position++;
            if (c == quote || c == '\n') {
                break;
            }
        }
        sb.append(text, start, position);
        return position;
    }
}
