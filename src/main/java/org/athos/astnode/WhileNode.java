package org.athos.astnode;

import org.athos.astvisitor.Visitor;

/**
 * The WhileNode class represents a {@code while (c) body} loop.
 * Guard vertices of a control-flow graph are WhileNodes with a null body.
 */
public class WhileNode extends AbstractNode {
    public Node condition;
    public Node body;

    public WhileNode(Node condition, Node body, SourceLocation location) {
        super(location);
        this.condition = condition;
        this.body = body;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
