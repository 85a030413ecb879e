package org.athos.astnode;

import org.athos.astvisitor.Visitor;

/**
 * The IfNode class represents a conditional statement {@code if (c) T else F}.
 * <p>
 * In a control-flow graph the same class is used for guard vertices, which
 * carry only a condition and have both branches set to null.
 */
public class IfNode extends AbstractNode {
    public Node condition;
    public Node thenBranch;
    /**
     * The else branch, or null when the statement has none.
     */
    public Node elseBranch;

    public IfNode(Node condition, Node thenBranch, Node elseBranch, SourceLocation location) {
        super(location);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
