package org.athos.astnode;

import org.athos.astvisitor.Visitor;

/**
 * The DeclarationNode class represents a C declaration: a variable, a
 * function prototype, a parameter, a struct field, or a tag-only
 * struct/enum definition (in which case {@link #name} is null).
 */
public class DeclarationNode extends AbstractNode {
    /**
     * The declared identifier, or null for {@code struct s { ... };}.
     */
    public String name;
    public TypeDescriptor type;
    /**
     * Optional initializer expression.
     */
    public Node initializer;

    public DeclarationNode(String name, TypeDescriptor type, Node initializer, SourceLocation location) {
        super(location);
        this.name = name;
        this.type = type;
        this.initializer = initializer;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
