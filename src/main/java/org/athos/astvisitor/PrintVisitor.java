package org.athos.astvisitor;

import org.athos.astnode.*;

/*
 * Prints the syntax tree as an indented outline, one node per line.
 *
 * Usage:
 *
 *   PrintVisitor printVisitor = new PrintVisitor();
 *   node.accept(printVisitor);
 *   return printVisitor.getResult();
 */
public class PrintVisitor implements Visitor {

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    public String getResult() {
        return sb.toString();
    }

    private void line(String text, Node node) {
        appendIndent();
        sb.append(text).append("  pos:").append(node.getLocation()).append("\n");
    }

    private void child(Node node) {
        indentLevel++;
        if (node == null) {
            appendIndent();
            sb.append("null\n");
        } else {
            node.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(BlockNode node) {
        line(node.isFileScope ? "BlockNode: file" : "BlockNode:", node);
        indentLevel++;
        for (Node element : node.elements) {
            if (element != null) {
                element.accept(this);
            }
        }
        indentLevel--;
    }

    @Override
    public void visit(IfNode node) {
        line("IfNode:", node);
        child(node.condition);
        child(node.thenBranch);
        if (node.elseBranch != null) {
            child(node.elseBranch);
        }
    }

    @Override
    public void visit(WhileNode node) {
        line("WhileNode:", node);
        child(node.condition);
        child(node.body);
    }

    @Override
    public void visit(FunctionDefinitionNode node) {
        line("FunctionDefinitionNode: " + node.getName(), node);
        child(node.signature);
        child(node.body);
    }

    @Override
    public void visit(ContinueNode node) {
        line("ContinueNode", node);
    }

    @Override
    public void visit(BreakNode node) {
        line("BreakNode", node);
    }

    @Override
    public void visit(ReturnNode node) {
        line("ReturnNode:", node);
        if (node.expression != null) {
            child(node.expression);
        }
    }

    @Override
    public void visit(EmptyStatementNode node) {
        line("EmptyStatementNode", node);
    }

    @Override
    public void visit(AssignmentNode node) {
        line("AssignmentNode: " + node.operator, node);
        child(node.lvalue);
        child(node.rvalue);
    }

    @Override
    public void visit(DeclarationNode node) {
        line("DeclarationNode: " + CodeGeneratorVisitor.declarationText(node), node);
    }

    @Override
    public void visit(IdentifierNode node) {
        line("IdentifierNode: " + node.name, node);
    }

    @Override
    public void visit(ConstantNode node) {
        line("ConstantNode: " + node.value, node);
    }

    @Override
    public void visit(FunctionCallNode node) {
        line("FunctionCallNode:", node);
        child(node.function);
        for (Node argument : node.arguments) {
            child(argument);
        }
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        line("BinaryOperatorNode: " + node.operator, node);
        child(node.left);
        child(node.right);
    }

    @Override
    public void visit(UnaryOperatorNode node) {
        line("UnaryOperatorNode: " + node.operator + (node.isPostfix ? " (postfix)" : ""), node);
        child(node.operand);
    }

    @Override
    public void visit(StructRefNode node) {
        line("StructRefNode: " + node.accessor + node.field, node);
        child(node.base);
    }

    @Override
    public void visit(MarkerNode node) {
        line("MarkerNode: " + node.kind, node);
    }
}
