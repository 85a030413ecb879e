package org.athos.parser;

import org.athos.astnode.*;
import org.athos.lexer.LexerToken;
import org.athos.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.athos.parser.TokenUtils.*;

/**
 * Parses C expressions by precedence climbing.
 * <p>
 * Assignments are right associative and bind loosest; binary operators
 * follow the C precedence table; prefix and postfix operators, calls and
 * member access bind tightest. The conditional operator, casts, the comma
 * operator and array subscripts are not supported.
 */
public class ParseExpression {

    // Binary operator precedence, higher binds tighter
    private static final Map<String, Integer> PRECEDENCE = Map.ofEntries(
            Map.entry("||", 1),
            Map.entry("&&", 2),
            Map.entry("|", 3),
            Map.entry("^", 4),
            Map.entry("&", 5),
            Map.entry("==", 6), Map.entry("!=", 6),
            Map.entry("<", 7), Map.entry(">", 7), Map.entry("<=", 7), Map.entry(">=", 7),
            Map.entry("<<", 8), Map.entry(">>", 8),
            Map.entry("+", 9), Map.entry("-", 9),
            Map.entry("*", 10), Map.entry("/", 10), Map.entry("%", 10)
    );

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=");

    private static final Set<String> PREFIX_OPERATORS = Set.of("!", "-", "+", "~", "*", "&", "++", "--");

    public static Node parseExpression(Parser parser) {
        return parseAssignment(parser);
    }

    public static Node parseAssignment(Parser parser) {
        Node left = parseBinary(parser, 0);
        LexerToken token = peek(parser);
        if (token.type == LexerTokenType.OPERATOR && ASSIGNMENT_OPERATORS.contains(token.text)) {
            consume(parser);
            Node right = parseAssignment(parser);
            return new AssignmentNode(token.text, left, right, left.getLocation());
        }
        return left;
    }

    /**
     * Parses a binary expression whose operators all have at least
     * {@code minPrecedence}.
     */
    public static Node parseBinary(Parser parser, int minPrecedence) {
        Node left = parseUnary(parser);
        while (true) {
            LexerToken token = peek(parser);
            Integer precedence = token.type == LexerTokenType.OPERATOR ? PRECEDENCE.get(token.text) : null;
            if (precedence == null || precedence < minPrecedence) {
                return left;
            }
            consume(parser);
            Node right = parseBinary(parser, precedence + 1);
            left = new BinaryOperatorNode(token.text, left, right, left.getLocation());
        }
    }

    private static Node parseUnary(Parser parser) {
        LexerToken token = peek(parser);
        if (token.type == LexerTokenType.OPERATOR && PREFIX_OPERATORS.contains(token.text)) {
            consume(parser);
            Node operand = parseUnary(parser);
            return new UnaryOperatorNode(token.text, operand, false, parser.location(token));
        }
        return parsePostfix(parser, parsePrimary(parser));
    }

    private static Node parsePostfix(Parser parser, Node expression) {
        while (true) {
            LexerToken token = peek(parser);
            if (token.isOperator("(")) {
                consume(parser);
                List<Node> arguments = new ArrayList<>();
                if (!consumeIfOperator(parser, ")")) {
                    do {
                        arguments.add(parseAssignment(parser));
                    } while (consumeIfOperator(parser, ","));
                    consume(parser, LexerTokenType.OPERATOR, ")");
                }
                expression = new FunctionCallNode(expression, arguments, expression.getLocation());
            } else if (token.isOperator("->") || token.isOperator(".")) {
                consume(parser);
                String field = consume(parser, LexerTokenType.IDENTIFIER).text;
                expression = new StructRefNode(expression, token.text, field, expression.getLocation());
            } else if (token.isOperator("++") || token.isOperator("--")) {
                consume(parser);
                expression = new UnaryOperatorNode(token.text, expression, true, expression.getLocation());
            } else if (token.isOperator("[")) {
                throw parser.error(token, "Array subscripts are not supported");
            } else {
                return expression;
            }
        }
    }

    private static Node parsePrimary(Parser parser) {
        LexerToken token = consume(parser);
        SourceLocation location = parser.location(token);
        switch (token.type) {
            case IDENTIFIER:
                return new IdentifierNode(token.text, location);
            case NUMBER:
            case STRING:
            case CHARACTER:
                return new ConstantNode(token.text, location);
            case OPERATOR:
                if (token.text.equals("(")) {
                    Node expression = parseExpression(parser);
                    consume(parser, LexerTokenType.OPERATOR, ")");
                    return expression;
                }
                break;
            default:
                break;
        }
        throw parser.error(token, "Unexpected " + describe(token) + " in expression");
    }
}
