package org.athos.lexer;

/**
 * The LexerToken class represents a lexical token: its type, its text and
 * the line it starts on.
 */
public class LexerToken {
    public final LexerTokenType type;
    public final String text;
    /**
     * 1-based line number of the first character of the token.
     */
    public final int line;

    public LexerToken(LexerTokenType type, String text, int line) {
        this.type = type;
        this.text = text;
        this.line = line;
    }

    public boolean is(LexerTokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    public boolean isOperator(String text) {
        return is(LexerTokenType.OPERATOR, text);
    }

    @Override
    public String toString() {
        return "LexerToken{" + "type=" + type + ", text='" + text + '\'' + ", line=" + line + '}';
    }
}
