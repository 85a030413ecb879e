package org.athos.parser;

import org.athos.lexer.LexerToken;
import org.athos.lexer.LexerTokenType;

/**
 * The TokenUtils class provides helper methods for looking at and
 * consuming tokens during parsing.
 */
public class TokenUtils {

    /**
     * Returns the current token without consuming it. Past the end of the
     * list the final EOF token is returned.
     *
     * @param parser The parser containing the token list and current token index.
     * @return The current LexerToken.
     */
    public static LexerToken peek(Parser parser) {
        return peek(parser, 0);
    }

    /**
     * Returns the token {@code offset} positions ahead without consuming anything.
     */
    public static LexerToken peek(Parser parser, int offset) {
        int index = Math.min(parser.tokenIndex + offset, parser.tokens.size() - 1);
        return parser.tokens.get(index);
    }

    /**
     * Consumes the current token.
     *
     * @param parser The parser containing the token list and current token index.
     * @return The consumed LexerToken, or the EOF token if the end of the list is reached.
     */
    public static LexerToken consume(Parser parser) {
        LexerToken token = peek(parser);
        if (token.type != LexerTokenType.EOF) {
            parser.tokenIndex++;
        }
        return token;
    }

    /**
     * Consumes the current token and checks its type.
     *
     * @throws ParseException if the token type does not match the expected type.
     */
    public static LexerToken consume(Parser parser, LexerTokenType type) {
        LexerToken token = consume(parser);
        if (token.type != type) {
            throw parser.error(token, "Expected " + type + " but got " + describe(token));
        }
        return token;
    }

    /**
     * Consumes the current token and checks its type and text.
     *
     * @throws ParseException if the token type or text does not match the expected values.
     */
    public static LexerToken consume(Parser parser, LexerTokenType type, String text) {
        LexerToken token = consume(parser);
        if (!token.is(type, text)) {
            throw parser.error(token, "Expected '" + text + "' but got " + describe(token));
        }
        return token;
    }

    /**
     * Consumes the current token if it is the operator {@code text}.
     *
     * @return true if a token was consumed
     */
    public static boolean consumeIfOperator(Parser parser, String text) {
        if (peek(parser).isOperator(text)) {
            parser.tokenIndex++;
            return true;
        }
        return false;
    }

    public static String describe(LexerToken token) {
        return token.type == LexerTokenType.EOF ? "end of file" : "'" + token.text + "'";
    }
}
