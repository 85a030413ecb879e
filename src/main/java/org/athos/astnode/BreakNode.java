package org.athos.astnode;

import org.athos.astvisitor.Visitor;

/**
 * Represents a {@code break;} statement.
 */
public class BreakNode extends AbstractNode {

    public BreakNode(SourceLocation location) {
        super(location);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
