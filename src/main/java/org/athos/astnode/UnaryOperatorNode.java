package org.athos.astnode;

import org.athos.astvisitor.Visitor;

/**
 * The UnaryOperatorNode class represents prefix operators
 * ({@code ! - + ~ * & ++ --}) and the postfix {@code ++}/{@code --}.
 */
public class UnaryOperatorNode extends AbstractNode {
    public final String operator;
    public Node operand;
    public final boolean isPostfix;

    public UnaryOperatorNode(String operator, Node operand, boolean isPostfix, SourceLocation location) {
        super(location);
        this.operator = operator;
        this.operand = operand;
        this.isPostfix = isPostfix;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
