package org.athos.astvisitor;

import org.athos.astnode.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Prints an AST back to C source text.
 * <p>
 * Nested binary operands are always parenthesized, so the output does not
 * depend on operator precedence. Unary operands are parenthesized unless
 * they are simple terms. Markers print nothing.
 * <pre>
 *   String code = CodeGeneratorVisitor.generate(ast);
 * </pre>
 */
public class CodeGeneratorVisitor implements Visitor {

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;

    public static String generate(Node node) {
        CodeGeneratorVisitor visitor = new CodeGeneratorVisitor();
        if (isExpression(node)) {
            node.accept(visitor);
        } else {
            visitor.statement(node);
        }
        return visitor.getResult();
    }

    public String getResult() {
        return sb.toString();
    }

    /**
     * Returns the text of a declaration without the trailing semicolon,
     * e.g. {@code struct list *mbox} or {@code int main()}.
     */
    public static String declarationText(DeclarationNode node) {
        String text = declaratorText(node.type, node.name == null ? "" : node.name);
        if (node.initializer != null) {
            text = text + " = " + generate(node.initializer);
        }
        return text;
    }

    private static String declaratorText(TypeDescriptor type, String declarator) {
        if (type instanceof PointerType pointer) {
            return declaratorText(pointer.target, "*" + declarator);
        }
        if (type instanceof FunctionType function) {
            List<String> parameters = new ArrayList<>();
            for (DeclarationNode parameter : function.parameters) {
                parameters.add(declarationText(parameter));
            }
            return declaratorText(function.returnType, declarator + "(" + String.join(", ", parameters) + ")");
        }
        String base = baseTypeText(type);
        return declarator.isEmpty() ? base : base + " " + declarator;
    }

    private static String baseTypeText(TypeDescriptor type) {
        if (type instanceof NamedType named) {
            return String.join(" ", named.names);
        }
        if (type instanceof EnumType enumType) {
            StringBuilder text = new StringBuilder(enumType.tag == null ? "enum" : "enum " + enumType.tag);
            if (enumType.enumerators != null) {
                text.append("\n{\n");
                for (int i = 0; i < enumType.enumerators.size(); i++) {
                    text.append("  ").append(enumType.enumerators.get(i));
                    text.append(i + 1 < enumType.enumerators.size() ? ",\n" : "\n");
                }
                text.append("}");
            }
            return text.toString();
        }
        if (type instanceof StructType struct) {
            StringBuilder text = new StringBuilder(struct.tag == null ? "struct" : "struct " + struct.tag);
            if (struct.fields != null) {
                text.append("\n{\n");
                for (DeclarationNode field : struct.fields) {
                    text.append("  ").append(declarationText(field)).append(";\n");
                }
                text.append("}");
            }
            return text.toString();
        }
        throw new IllegalArgumentException("Unsupported type descriptor: " + type);
    }

    private static boolean isExpression(Node node) {
        return node instanceof AssignmentNode
                || node instanceof IdentifierNode
                || node instanceof ConstantNode
                || node instanceof FunctionCallNode
                || node instanceof BinaryOperatorNode
                || node instanceof UnaryOperatorNode
                || node instanceof StructRefNode;
    }

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    private void statement(Node node) {
        if (isExpression(node)) {
            appendIndent();
            node.accept(this);
            sb.append(";\n");
        } else {
            node.accept(this);
        }
    }

    private void branch(Node node) {
        if (node instanceof BlockNode) {
            statement(node);
            return;
        }
        indentLevel++;
        if (node == null) {
            appendIndent();
            sb.append(";\n");
        } else {
            statement(node);
        }
        indentLevel--;
    }

    private void operand(Node node) {
        boolean parenthesize = node instanceof BinaryOperatorNode || node instanceof AssignmentNode;
        if (parenthesize) {
            sb.append("(");
        }
        node.accept(this);
        if (parenthesize) {
            sb.append(")");
        }
    }

    /**
     * Prints the operand of a unary operator, parenthesized unless it is a
     * simple term, so {@code -(-y)} and {@code (*p)++} keep their meaning.
     */
    private void unaryOperand(Node node) {
        boolean simple = node instanceof IdentifierNode
                || node instanceof ConstantNode
                || node instanceof FunctionCallNode
                || node instanceof StructRefNode;
        if (!simple) {
            sb.append("(");
        }
        node.accept(this);
        if (!simple) {
            sb.append(")");
        }
    }

    /**
     * Returns true if {@code node} ends in an {@code if} without {@code else},
     * which would capture an {@code else} printed after it.
     */
    private static boolean endsWithOpenIf(Node node) {
        if (node instanceof IfNode conditional) {
            return conditional.elseBranch == null || endsWithOpenIf(conditional.elseBranch);
        }
        if (node instanceof WhileNode loop) {
            return endsWithOpenIf(loop.body);
        }
        return false;
    }

    @Override
    public void visit(BlockNode node) {
        if (node.isFileScope) {
            for (Node element : node.elements) {
                statement(element);
                if (element instanceof FunctionDefinitionNode) {
                    sb.append("\n");
                }
            }
            return;
        }
        appendIndent();
        sb.append("{\n");
        indentLevel++;
        for (Node element : node.elements) {
            statement(element);
        }
        indentLevel--;
        appendIndent();
        sb.append("}\n");
    }

    @Override
    public void visit(IfNode node) {
        appendIndent();
        sb.append("if (");
        node.condition.accept(this);
        sb.append(")\n");
        if (node.elseBranch != null && endsWithOpenIf(node.thenBranch)) {
            List<Node> braced = new ArrayList<>();
            braced.add(node.thenBranch);
            branch(new BlockNode(braced, node.thenBranch.getLocation()));
        } else {
            branch(node.thenBranch);
        }
        if (node.elseBranch != null) {
            appendIndent();
            sb.append("else\n");
            branch(node.elseBranch);
        }
    }

    @Override
    public void visit(WhileNode node) {
        appendIndent();
        sb.append("while (");
        node.condition.accept(this);
        sb.append(")\n");
        branch(node.body);
    }

    @Override
    public void visit(FunctionDefinitionNode node) {
        appendIndent();
        sb.append(declarationText(node.signature)).append("\n");
        branch(node.body);
    }

    @Override
    public void visit(ContinueNode node) {
        appendIndent();
        sb.append("continue;\n");
    }

    @Override
    public void visit(BreakNode node) {
        appendIndent();
        sb.append("break;\n");
    }

    @Override
    public void visit(ReturnNode node) {
        appendIndent();
        sb.append("return");
        if (node.expression != null) {
            sb.append(" ");
            node.expression.accept(this);
        }
        sb.append(";\n");
    }

    @Override
    public void visit(EmptyStatementNode node) {
        appendIndent();
        sb.append(";\n");
    }

    @Override
    public void visit(AssignmentNode node) {
        node.lvalue.accept(this);
        sb.append(" ").append(node.operator).append(" ");
        node.rvalue.accept(this);
    }

    @Override
    public void visit(DeclarationNode node) {
        appendIndent();
        sb.append(declarationText(node)).append(";\n");
    }

    @Override
    public void visit(IdentifierNode node) {
        sb.append(node.name);
    }

    @Override
    public void visit(ConstantNode node) {
        sb.append(node.value);
    }

    @Override
    public void visit(FunctionCallNode node) {
        operand(node.function);
        sb.append("(");
        for (int i = 0; i < node.arguments.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            node.arguments.get(i).accept(this);
        }
        sb.append(")");
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        operand(node.left);
        sb.append(" ").append(node.operator).append(" ");
        operand(node.right);
    }

    @Override
    public void visit(UnaryOperatorNode node) {
        if (node.isPostfix) {
            unaryOperand(node.operand);
            sb.append(node.operator);
        } else {
            sb.append(node.operator);
            unaryOperand(node.operand);
        }
    }

    @Override
    public void visit(StructRefNode node) {
        boolean parenthesize = !(node.base instanceof IdentifierNode
                || node.base instanceof StructRefNode
                || node.base instanceof FunctionCallNode);
        if (parenthesize) {
            sb.append("(");
        }
        node.base.accept(this);
        if (parenthesize) {
            sb.append(")");
        }
        sb.append(node.accessor).append(node.field);
    }

    @Override
    public void visit(MarkerNode node) {
    }
}
