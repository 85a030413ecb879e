package org.athos.astnode;

import org.athos.astvisitor.Visitor;

/**
 * The AssignmentNode class represents {@code lvalue op rvalue} where op is
 * one of the C assignment operators ({@code =}, {@code +=}, ...).
 */
public class AssignmentNode extends AbstractNode {
    public final String operator;
    public Node lvalue;
    public Node rvalue;

    public AssignmentNode(String operator, Node lvalue, Node rvalue, SourceLocation location) {
        super(location);
        this.operator = operator;
        this.lvalue = lvalue;
        this.rvalue = rvalue;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
