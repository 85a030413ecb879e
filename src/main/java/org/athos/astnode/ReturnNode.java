package org.athos.astnode;

import org.athos.astvisitor.Visitor;

/**
 * Represents a {@code return} statement with an optional value.
 */
public class ReturnNode extends AbstractNode {
    public Node expression;

    public ReturnNode(Node expression, SourceLocation location) {
        super(location);
        this.expression = expression;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
