package org.athos.astnode;

import org.athos.astvisitor.Visitor;

/**
 * The FunctionDefinitionNode class represents a function with a body.
 * The signature is a declaration whose type is a {@link FunctionType}.
 */
public class FunctionDefinitionNode extends AbstractNode {
    public DeclarationNode signature;
    /**
     * The function body; null for the entry vertex of a control-flow graph.
     */
    public BlockNode body;

    public FunctionDefinitionNode(DeclarationNode signature, BlockNode body, SourceLocation location) {
        super(location);
        this.signature = signature;
        this.body = body;
    }

    public String getName() {
        return signature.name;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
