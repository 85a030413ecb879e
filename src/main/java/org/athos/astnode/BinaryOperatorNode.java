package org.athos.astnode;

import org.athos.astvisitor.Visitor;

/**
 * The BinaryOperatorNode class represents {@code left operator right}.
 */
public class BinaryOperatorNode extends AbstractNode {
    public final String operator;
    public Node left;
    public Node right;

    public BinaryOperatorNode(String operator, Node left, Node right, SourceLocation location) {
        super(location);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
