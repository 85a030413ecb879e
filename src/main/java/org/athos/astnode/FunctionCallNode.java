package org.athos.astnode;

import org.athos.astvisitor.Visitor;

import java.util.List;

/**
 * The FunctionCallNode class represents {@code function(arguments...)}.
 */
public class FunctionCallNode extends AbstractNode {
    public Node function;
    public final List<Node> arguments;

    public FunctionCallNode(Node function, List<Node> arguments, SourceLocation location) {
        super(location);
        this.function = function;
        this.arguments = arguments;
    }

    /**
     * Returns the called function's name when the callee is a plain identifier.
     *
     * @return the name, or null for an indirect call
     */
    public String getFunctionName() {
        return function instanceof IdentifierNode id ? id.name : null;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
