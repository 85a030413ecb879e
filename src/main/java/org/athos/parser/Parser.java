package org.athos.parser;

import org.athos.astnode.BlockNode;
import org.athos.astnode.SourceLocation;
import org.athos.lexer.Lexer;
import org.athos.lexer.LexerToken;
import org.athos.lexer.LexerTokenType;

import java.util.List;

import static org.athos.parser.TokenUtils.peek;

/**
 * The Parser class turns a list of tokens into an abstract syntax tree.
 * <p>
 * It accepts the C subset used to write event-loop protocol models:
 * struct and enum definitions, variable and function declarations,
 * function definitions, and the statements {@code if}, {@code while},
 * {@code continue}, {@code break}, {@code return}, blocks and expression
 * statements. The result is a file-scope {@link BlockNode}.
 */
public class Parser {

    // Name of the parsed file, used in locations and error messages.
    public final String fileName;
    // List of tokens to be parsed.
    public final List<LexerToken> tokens;
    // Current index in the token list.
    public int tokenIndex = 0;

    public Parser(String fileName, List<LexerToken> tokens) {
        this.fileName = fileName;
        this.tokens = tokens;
    }

    /**
     * Tokenizes and parses source text that has no comments left.
     *
     * @param fileName name used in locations and error messages
     * @param code     the source text
     * @return the file-scope block
     * @throws ParseException on a syntax error
     */
    public static BlockNode parse(String fileName, String code) {
        List<LexerToken> tokens = new Lexer(code, fileName).tokenize();
        return new Parser(fileName, tokens).parse();
    }

    /**
     * Parses the tokens into an abstract syntax tree (AST).
     *
     * @return The file-scope block holding the external declarations.
     */
    public BlockNode parse() {
        BlockNode file = new BlockNode(location(peek(this)));
        file.isFileScope = true;
        while (peek(this).type != LexerTokenType.EOF) {
            file.elements.addAll(ParseDeclaration.parseDeclaration(this, true));
        }
        return file;
    }

    public SourceLocation location(LexerToken token) {
        return new SourceLocation(fileName, token.line);
    }

    public ParseException error(LexerToken token, String message) {
        return new ParseException(fileName, token.line, message);
    }
}
