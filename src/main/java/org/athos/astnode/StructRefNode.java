package org.athos.astnode;

import org.athos.astvisitor.Visitor;

/**
 * The StructRefNode class represents a member access {@code base->field}
 * or {@code base.field}. The field is a member name, not a variable
 * reference, so it is kept as a plain string.
 */
public class StructRefNode extends AbstractNode {
    public Node base;
    /**
     * Either "->" or ".".
     */
    public final String accessor;
    public final String field;

    public StructRefNode(Node base, String accessor, String field, SourceLocation location) {
        super(location);
        this.base = base;
        this.accessor = accessor;
        this.field = field;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
