package org.athos.astnode;

import org.athos.astvisitor.PrintVisitor;

/**
 * Abstract base class for AST nodes that includes the source location
 * the node was parsed from. The location is only used for labels and
 * error messages; it is not a key.
 * <p>
 * It also provides deep toString() formatting using PrintVisitor.
 * equals() and hashCode() are inherited from Object.
 */
public abstract class AbstractNode implements Node {
    public SourceLocation location;

    protected AbstractNode(SourceLocation location) {
        this.location = location == null ? SourceLocation.UNKNOWN : location;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    /**
     * Returns a string representation of the syntax tree.
     *
     * @return a string representation of the syntax tree
     */
    @Override
    public String toString() {
        PrintVisitor printVisitor = new PrintVisitor();
        this.accept(printVisitor);
        return printVisitor.getResult();
    }
}
