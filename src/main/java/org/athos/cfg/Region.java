package org.athos.cfg;

import org.athos.astnode.Node;

/**
 * The single entry and single exit of the graph fragment produced by
 * translating one AST subtree. Fragments compose by adding an edge from
 * one region's {@code last} to the next region's {@code first}.
 */
public final class Region {
    /**
     * Returned for an empty sequence; both ends are null.
     */
    public static final Region EMPTY = new Region(null, null);

    public final Node first;
    public final Node last;

    public Region(Node first, Node last) {
        this.first = first;
        this.last = last;
    }

    public boolean isEmpty() {
        return first == null;
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "Region{empty}";
        }
        return "Region{first=" + first.getClass().getSimpleName() + "@" + first.getLocation()
                + ", last=" + last.getClass().getSimpleName() + "@" + last.getLocation() + '}';
    }
}
