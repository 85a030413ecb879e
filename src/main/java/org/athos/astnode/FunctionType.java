package org.athos.astnode;

import org.athos.astvisitor.CloneVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * A function type: return type and parameter declarations. Parameter
 * declarations may be unnamed.
 */
public class FunctionType extends TypeDescriptor {
    public final TypeDescriptor returnType;
    public final List<DeclarationNode> parameters;

    public FunctionType(TypeDescriptor returnType, List<DeclarationNode> parameters) {
        this.returnType = returnType;
        this.parameters = parameters;
    }

    @Override
    public TypeDescriptor copy() {
        List<DeclarationNode> copies = new ArrayList<>(parameters.size());
        for (DeclarationNode parameter : parameters) {
            copies.add((DeclarationNode) CloneVisitor.clone(parameter));
        }
        return new FunctionType(returnType.copy(), copies);
    }

    @Override
    public String toString() {
        return returnType + " (" + parameters.size() + " parameters)";
    }
}
