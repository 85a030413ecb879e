package org.athos.astvisitor;

import org.athos.astnode.*;

/**
 * A visitor that walks the whole tree in pre-order and does nothing else.
 * Subclasses override the methods for the node kinds they care about and
 * call {@code super.visit(node)} to keep descending.
 * <p>
 * Null children (guard vertices, missing else branches) are skipped.
 */
public abstract class DepthFirstVisitor implements Visitor {

    protected void visitChild(Node node) {
        if (node != null) {
            node.accept(this);
        }
    }

    @Override
    public void visit(BlockNode node) {
        // Iterate over a snapshot so subclasses may edit the list
        for (Node element : node.elements.toArray(new Node[0])) {
            visitChild(element);
        }
    }

    @Override
    public void visit(IfNode node) {
        visitChild(node.condition);
        visitChild(node.thenBranch);
        visitChild(node.elseBranch);
    }

    @Override
    public void visit(WhileNode node) {
        visitChild(node.condition);
        visitChild(node.body);
    }

    @Override
    public void visit(FunctionDefinitionNode node) {
        visitChild(node.body);
    }

    @Override
    public void visit(ContinueNode node) {
    }

    @Override
    public void visit(BreakNode node) {
    }

    @Override
    public void visit(ReturnNode node) {
        visitChild(node.expression);
    }

    @Override
    public void visit(EmptyStatementNode node) {
    }

    @Override
    public void visit(AssignmentNode node) {
        visitChild(node.lvalue);
        visitChild(node.rvalue);
    }

    @Override
    public void visit(DeclarationNode node) {
        visitChild(node.initializer);
    }

    @Override
    public void visit(IdentifierNode node) {
    }

    @Override
    public void visit(ConstantNode node) {
    }

    @Override
    public void visit(FunctionCallNode node) {
        visitChild(node.function);
        for (Node argument : node.arguments) {
            visitChild(argument);
        }
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        visitChild(node.left);
        visitChild(node.right);
    }

    @Override
    public void visit(UnaryOperatorNode node) {
        visitChild(node.operand);
    }

    @Override
    public void visit(StructRefNode node) {
        visitChild(node.base);
    }

    @Override
    public void visit(MarkerNode node) {
    }
}
