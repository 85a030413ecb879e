package org.athos.parser;

import org.athos.astnode.*;
import org.athos.lexer.LexerToken;
import org.athos.lexer.LexerTokenType;

import static org.athos.parser.TokenUtils.*;

/**
 * The ParseStatement class parses statements and compound statements.
 */
public class ParseStatement {

    /**
     * Parses a single statement from the parser's token stream.
     *
     * @param parser The parser instance used for parsing.
     * @return A Node representing the parsed statement.
     */
    public static Node parseStatement(Parser parser) {
        LexerToken token = peek(parser);
        SourceLocation location = parser.location(token);

        if (token.isOperator("{")) {
            return parseBlock(parser);
        }
        if (token.isOperator(";")) {
            consume(parser);
            return new EmptyStatementNode(location);
        }
        if (token.type == LexerTokenType.IDENTIFIER) {
            switch (token.text) {
                case "if":
                    return parseIfStatement(parser);
                case "while":
                    return parseWhileStatement(parser);
                case "continue":
                    consume(parser);
                    consume(parser, LexerTokenType.OPERATOR, ";");
                    return new ContinueNode(location);
                case "break":
                    consume(parser);
                    consume(parser, LexerTokenType.OPERATOR, ";");
                    return new BreakNode(location);
                case "return": {
                    consume(parser);
                    Node expression = null;
                    if (!peek(parser).isOperator(";")) {
                        expression = ParseExpression.parseExpression(parser);
                    }
                    consume(parser, LexerTokenType.OPERATOR, ";");
                    return new ReturnNode(expression, location);
                }
                case "for", "do", "switch", "goto":
                    throw parser.error(token, "Statement '" + token.text + "' is not supported");
                default:
                    if (ParseDeclaration.startsDeclaration(parser)) {
                        throw parser.error(token, "A declaration is not allowed here");
                    }
            }
        }

        Node expression = ParseExpression.parseExpression(parser);
        consume(parser, LexerTokenType.OPERATOR, ";");
        return expression;
    }

    /**
     * Parses a compound statement, declarations included.
     */
    public static BlockNode parseBlock(Parser parser) {
        LexerToken open = consume(parser, LexerTokenType.OPERATOR, "{");
        BlockNode block = new BlockNode(parser.location(open));
        while (!consumeIfOperator(parser, "}")) {
            if (peek(parser).type == LexerTokenType.EOF) {
                throw parser.error(peek(parser), "Missing '}' for block opened at line " + open.line);
            }
            if (ParseDeclaration.startsDeclaration(parser)) {
                block.elements.addAll(ParseDeclaration.parseDeclaration(parser, false));
            } else {
                block.elements.add(parseStatement(parser));
            }
        }
        return block;
    }

    private static Node parseIfStatement(Parser parser) {
        LexerToken keyword = consume(parser);
        Node condition = parseParenthesizedCondition(parser);
        Node thenBranch = parseStatement(parser);
        Node elseBranch = null;
        if (peek(parser).is(LexerTokenType.IDENTIFIER, "else")) {
            consume(parser);
            elseBranch = parseStatement(parser);
        }
        return new IfNode(condition, thenBranch, elseBranch, parser.location(keyword));
    }

    private static Node parseWhileStatement(Parser parser) {
        LexerToken keyword = consume(parser);
        Node condition = parseParenthesizedCondition(parser);
        Node body = parseStatement(parser);
        return new WhileNode(condition, body, parser.location(keyword));
    }

    private static Node parseParenthesizedCondition(Parser parser) {
        consume(parser, LexerTokenType.OPERATOR, "(");
        Node condition = ParseExpression.parseExpression(parser);
        consume(parser, LexerTokenType.OPERATOR, ")");
        return condition;
    }
}
