package org.athos.astnode;

import org.athos.astvisitor.Visitor;

/**
 * The IdentifierNode class represents a reference to a variable, function
 * or enumeration constant.
 * <p>
 * The name is mutable: renaming passes rewrite it in place.
 */
public class IdentifierNode extends AbstractNode {
    public String name;

    public IdentifierNode(String name, SourceLocation location) {
        super(location);
        this.name = name;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
