package org.athos.lexer;

import org.athos.parser.ParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer class converts C source text into a list of tokens.
 * <p>
 * Whitespace is dropped, line numbers are tracked for every token, and
 * preprocessor lines (a {@code #} as the first non-blank character) are
 * skipped entirely. Comments are expected to have been removed already,
 * see {@link org.athos.frontend.CommentStripper}.
 * <p>
 * Operators are matched longest first, so {@code ->}, {@code ++} and
 * {@code +=} come out as single tokens.
 */
public class Lexer {
    // Multi-character operators, longest first
    private static final String[] OPERATORS = {
            "<<=", ">>=", "...",
            "->", "++", "--", "&&", "||", "==", "!=", "<=", ">=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<", ">>"
    };
    private static final String SINGLE_OPERATORS = "{}()[];,.:?=<>+-*/%!~&|^";

    private final String fileName;
    private final String input;
    private final int length;
    private int position;
    private int line;
    private boolean atLineStart;

    public Lexer(String input, String fileName) {
        this.input = input;
        this.fileName = fileName;
        this.length = input.length();
        this.position = 0;
        this.line = 1;
        this.atLineStart = true;
    }

    // Method to tokenize the input string into a list of tokens
    public List<LexerToken> tokenize() {
        List<LexerToken> tokens = new ArrayList<>();
        LexerToken token;
        while ((token = nextToken()) != null) {
            tokens.add(token);
        }
        tokens.add(new LexerToken(LexerTokenType.EOF, "", line));
        return tokens;
    }

    public LexerToken nextToken() {
        skipWhitespaceAndDirectives();
        if (position >= length) {
            return null;
        }
        char current = input.charAt(position);
        atLineStart = false;

        if (Character.isDigit(current)) {
            return consumeNumber();
        } else if (Character.isLetter(current) || current == '_') {
            return consumeIdentifier();
        } else if (current == '"') {
            return consumeQuoted('"', LexerTokenType.STRING);
        } else if (current == '\'') {
            return consumeQuoted('\'', LexerTokenType.CHARACTER);
        }
        return consumeOperator();
    }

    private void skipWhitespaceAndDirectives() {
        while (position < length) {
            char c = input.charAt(position);
            if (c == '\n') {
                line++;
                position++;
                atLineStart = true;
            } else if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                position++;
            } else if (c == '#' && atLineStart) {
                skipDirective();
            } else {
                return;
            }
        }
    }

    private void skipDirective() {
        while (position < length && input.charAt(position) != '\n') {
            // A backslash-newline continues the directive
            if (input.charAt(position) == '\\' && position + 1 < length && input.charAt(position + 1) == '\n') {
                line++;
                position++;
            }
            position++;
        }
    }

    private LexerToken consumeNumber() {
        int start = position;
        while (position < length
                && (Character.isLetterOrDigit(input.charAt(position)) || input.charAt(position) == '.')) {
            position++;
        }
        return new LexerToken(LexerTokenType.NUMBER, input.substring(start, position), line);
    }

    private LexerToken consumeIdentifier() {
        int start = position;
        while (position < length
                && (Character.isLetterOrDigit(input.charAt(position)) || input.charAt(position) == '_')) {
            position++;
        }
        return new LexerToken(LexerTokenType.IDENTIFIER, input.substring(start, position), line);
    }

    private LexerToken consumeQuoted(char quote, LexerTokenType type) {
        int start = position;
        int startLine = line;
        position++;
        while (position < length && input.charAt(position) != quote) {
            char c = input.charAt(position);
            if (c == '\\') {
                position++;
            } else if (c == '\n') {
                throw new ParseException(fileName, startLine, "Unterminated literal");
            }
            position++;
        }
        if (position >= length) {
            throw new ParseException(fileName, startLine, "Unterminated literal");
        }
        position++;
        return new LexerToken(type, input.substring(start, position), startLine);
    }

    private LexerToken consumeOperator() {
        for (String operator : OPERATORS) {
            if (input.startsWith(operator, position)) {
                position += operator.length();
                return new LexerToken(LexerTokenType.OPERATOR, operator, line);
            }
        }
        char c = input.charAt(position);
        if (SINGLE_OPERATORS.indexOf(c) < 0) {
            throw new ParseException(fileName, line, "Unexpected character '" + c + "'");
        }
        position++;
        return new LexerToken(LexerTokenType.OPERATOR, String.valueOf(c), line);
    }
}
