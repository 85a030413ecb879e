package org.athos.astnode;

import org.athos.astvisitor.Visitor;

/**
 * Represents the empty statement {@code ;}.
 */
public class EmptyStatementNode extends AbstractNode {

    public EmptyStatementNode(SourceLocation location) {
        super(location);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
