package org.athos.lexer;

/**
 * Categories of tokens produced by the {@link Lexer}.
 */
public enum LexerTokenType {
    IDENTIFIER,
    NUMBER,
    STRING,
    CHARACTER,
    OPERATOR,
    EOF
}
