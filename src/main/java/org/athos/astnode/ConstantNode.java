package org.athos.astnode;

import org.athos.astvisitor.Visitor;

/**
 * The ConstantNode class represents a literal, stored as its source text
 * (quotes included for string and character literals).
 */
public class ConstantNode extends AbstractNode {
    public final String value;

    public ConstantNode(String value, SourceLocation location) {
        super(location);
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
