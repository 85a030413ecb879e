package org.athos.astvisitor;

import org.athos.astnode.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Deep clones AST nodes. Every node of the copy is a new instance, leaves
 * included, because renaming passes mutate identifiers in place and a
 * shared leaf would be renamed in every copy at once.
 */
public class CloneVisitor implements Visitor {
    private Node clonedNode;

    public static Node clone(Node node) {
        if (node == null) return null;
        CloneVisitor visitor = new CloneVisitor();
        node.accept(visitor);
        return visitor.clonedNode;
    }

    public static List<Node> cloneList(List<Node> nodes) {
        List<Node> cloned = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            cloned.add(clone(node));
        }
        return cloned;
    }

    @Override
    public void visit(BlockNode node) {
        BlockNode copy = new BlockNode(cloneList(node.elements), node.location);
        copy.isFileScope = node.isFileScope;
        clonedNode = copy;
    }

    @Override
    public void visit(IfNode node) {
        clonedNode = new IfNode(
                clone(node.condition),
                clone(node.thenBranch),
                clone(node.elseBranch),
                node.location
        );
    }

    @Override
    public void visit(WhileNode node) {
        clonedNode = new WhileNode(clone(node.condition), clone(node.body), node.location);
    }

    @Override
    public void visit(FunctionDefinitionNode node) {
        clonedNode = new FunctionDefinitionNode(
                (DeclarationNode) clone(node.signature),
                (BlockNode) clone(node.body),
                node.location
        );
    }

    @Override
    public void visit(ContinueNode node) {
        clonedNode = new ContinueNode(node.location);
    }

    @Override
    public void visit(BreakNode node) {
        clonedNode = new BreakNode(node.location);
    }

    @Override
    public void visit(ReturnNode node) {
        clonedNode = new ReturnNode(clone(node.expression), node.location);
    }

    @Override
    public void visit(EmptyStatementNode node) {
        clonedNode = new EmptyStatementNode(node.location);
    }

    @Override
    public void visit(AssignmentNode node) {
        clonedNode = new AssignmentNode(node.operator, clone(node.lvalue), clone(node.rvalue), node.location);
    }

    @Override
    public void visit(DeclarationNode node) {
        clonedNode = new DeclarationNode(
                node.name,
                node.type == null ? null : node.type.copy(),
                clone(node.initializer),
                node.location
        );
    }

    @Override
    public void visit(IdentifierNode node) {
        clonedNode = new IdentifierNode(node.name, node.location);
    }

    @Override
    public void visit(ConstantNode node) {
        clonedNode = new ConstantNode(node.value, node.location);
    }

    @Override
    public void visit(FunctionCallNode node) {
        clonedNode = new FunctionCallNode(clone(node.function), cloneList(node.arguments), node.location);
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        clonedNode = new BinaryOperatorNode(node.operator, clone(node.left), clone(node.right), node.location);
    }

    @Override
    public void visit(UnaryOperatorNode node) {
        clonedNode = new UnaryOperatorNode(node.operator, clone(node.operand), node.isPostfix, node.location);
    }

    @Override
    public void visit(StructRefNode node) {
        clonedNode = new StructRefNode(clone(node.base), node.accessor, node.field, node.location);
    }

    @Override
    public void visit(MarkerNode node) {
        clonedNode = new MarkerNode(node.kind, node.location);
    }
}
