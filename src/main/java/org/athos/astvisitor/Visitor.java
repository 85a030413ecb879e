package org.athos.astvisitor;

import org.athos.astnode.*;

/**
 * The Visitor interface declares one visit method per node kind.
 * Adding a node kind forces every visitor to handle it.
 */
public interface Visitor {

    void visit(BlockNode node);

    void visit(IfNode node);

    void visit(WhileNode node);

    void visit(FunctionDefinitionNode node);

    void visit(ContinueNode node);

    void visit(BreakNode node);

    void visit(ReturnNode node);

    void visit(EmptyStatementNode node);

    void visit(AssignmentNode node);

    void visit(DeclarationNode node);

    void visit(IdentifierNode node);

    void visit(ConstantNode node);

    void visit(FunctionCallNode node);

    void visit(BinaryOperatorNode node);

    void visit(UnaryOperatorNode node);

    void visit(StructRefNode node);

    void visit(MarkerNode node);
}
