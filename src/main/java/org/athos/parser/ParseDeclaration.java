package org.athos.parser;

import org.athos.astnode.*;
import org.athos.astvisitor.CodeGeneratorVisitor;
import org.athos.lexer.LexerToken;
import org.athos.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.athos.parser.TokenUtils.*;

/**
 * Parses declarations: type specifiers, declarators, struct and enum
 * definitions, prototypes and function definitions.
 */
public class ParseDeclaration {

    static final Set<String> TYPE_KEYWORDS = Set.of(
            "void", "char", "short", "int", "long", "float", "double",
            "signed", "unsigned", "_Bool",
            "const", "volatile", "static", "extern", "register", "inline");

    /**
     * Returns true if the current token begins a declaration.
     */
    public static boolean startsDeclaration(Parser parser) {
        LexerToken token = peek(parser);
        return token.type == LexerTokenType.IDENTIFIER
                && (TYPE_KEYWORDS.contains(token.text) || token.text.equals("struct") || token.text.equals("enum"));
    }

    /**
     * Parses one declaration statement, which may declare several names
     * ({@code int a, *b;}).
     *
     * @param parser                  the parser
     * @param allowFunctionDefinition true at file scope, where a declarator
     *                                may be followed by a function body
     * @return the declarations, or a single function definition
     */
    public static List<Node> parseDeclaration(Parser parser, boolean allowFunctionDefinition) {
        LexerToken start = peek(parser);
        SourceLocation location = parser.location(start);
        TypeDescriptor base = parseTypeSpecifier(parser);

        List<Node> declarations = new ArrayList<>();
        if (consumeIfOperator(parser, ";")) {
            // Tag-only declaration: struct s { ... };
            declarations.add(new DeclarationNode(null, base, null, location));
            return declarations;
        }

        DeclarationNode first = parseDeclarator(parser, base, location, false);
        if (first.type instanceof FunctionType && peek(parser).isOperator("{")) {
            if (!allowFunctionDefinition) {
                throw parser.error(peek(parser), "Function definition is not allowed here");
            }
            BlockNode body = ParseStatement.parseBlock(parser);
            declarations.add(new FunctionDefinitionNode(first, body, location));
            return declarations;
        }

        parseInitializer(parser, first);
        declarations.add(first);
        while (consumeIfOperator(parser, ",")) {
            DeclarationNode next = parseDeclarator(parser, referenceTo(base), parser.location(peek(parser)), false);
            parseInitializer(parser, next);
            declarations.add(next);
        }
        consume(parser, LexerTokenType.OPERATOR, ";");
        return declarations;
    }

    /**
     * Returns the type of a later declarator in {@code enum t { ... } a, b;}:
     * only the first one carries the definition.
     */
    private static TypeDescriptor referenceTo(TypeDescriptor base) {
        if (base instanceof EnumType enumType && enumType.tag != null) {
            return new EnumType(enumType.tag, null);
        }
        if (base instanceof StructType struct && struct.tag != null) {
            return new StructType(struct.tag, null);
        }
        return base.copy();
    }

    private static void parseInitializer(Parser parser, DeclarationNode declaration) {
        if (consumeIfOperator(parser, "=")) {
            declaration.initializer = ParseExpression.parseAssignment(parser);
        }
    }

    /**
     * Parses the type part of a declaration: keywords such as
     * {@code unsigned int}, or a struct or enum specifier.
     */
    public static TypeDescriptor parseTypeSpecifier(Parser parser) {
        LexerToken token = peek(parser);
        if (token.is(LexerTokenType.IDENTIFIER, "struct")) {
            consume(parser);
            return parseStructSpecifier(parser);
        }
        if (token.is(LexerTokenType.IDENTIFIER, "enum")) {
            consume(parser);
            return parseEnumSpecifier(parser);
        }

        List<String> names = new ArrayList<>();
        while (peek(parser).type == LexerTokenType.IDENTIFIER && TYPE_KEYWORDS.contains(peek(parser).text)) {
            names.add(consume(parser).text);
        }
        if (names.isEmpty()) {
            throw parser.error(token, "Expected a type but got " + describe(token));
        }
        return new NamedType(names);
    }

    private static TypeDescriptor parseStructSpecifier(Parser parser) {
        String tag = null;
        if (peek(parser).type == LexerTokenType.IDENTIFIER) {
            tag = consume(parser).text;
        }
        if (!consumeIfOperator(parser, "{")) {
            if (tag == null) {
                throw parser.error(peek(parser), "Expected a struct tag or '{'");
            }
            return new StructType(tag, null);
        }
        List<DeclarationNode> fields = new ArrayList<>();
        while (!consumeIfOperator(parser, "}")) {
            if (peek(parser).type == LexerTokenType.EOF) {
                throw parser.error(peek(parser), "Unterminated struct definition");
            }
            for (Node field : parseDeclaration(parser, false)) {
                fields.add((DeclarationNode) field);
            }
        }
        return new StructType(tag, fields);
    }

    private static TypeDescriptor parseEnumSpecifier(Parser parser) {
        String tag = null;
        if (peek(parser).type == LexerTokenType.IDENTIFIER) {
            tag = consume(parser).text;
        }
        if (!consumeIfOperator(parser, "{")) {
            if (tag == null) {
                throw parser.error(peek(parser), "Expected an enum tag or '{'");
            }
            return new EnumType(tag, null);
        }
        List<String> enumerators = new ArrayList<>();
        while (!consumeIfOperator(parser, "}")) {
            String enumerator = consume(parser, LexerTokenType.IDENTIFIER).text;
            if (consumeIfOperator(parser, "=")) {
                enumerator = enumerator + " = " + CodeGeneratorVisitor.generate(ParseExpression.parseBinary(parser, 0));
            }
            enumerators.add(enumerator);
            if (!peek(parser).isOperator("}")) {
                consume(parser, LexerTokenType.OPERATOR, ",");
            }
        }
        return new EnumType(tag, enumerators);
    }

    /**
     * Parses a declarator: pointer stars, the name and an optional
     * parameter list.
     *
     * @param optionalName true for parameters, which may be unnamed
     */
    static DeclarationNode parseDeclarator(Parser parser, TypeDescriptor base, SourceLocation location,
                                           boolean optionalName) {
        TypeDescriptor type = base;
        while (consumeIfOperator(parser, "*")) {
            type = new PointerType(type);
            // Qualifiers after '*' are not kept
            while (peek(parser).is(LexerTokenType.IDENTIFIER, "const")
                    || peek(parser).is(LexerTokenType.IDENTIFIER, "volatile")) {
                consume(parser);
            }
        }

        String name = null;
        if (peek(parser).type == LexerTokenType.IDENTIFIER) {
            name = consume(parser).text;
        } else if (!optionalName) {
            throw parser.error(peek(parser), "Expected an identifier but got " + describe(peek(parser)));
        }

        if (consumeIfOperator(parser, "(")) {
            type = new FunctionType(type, parseParameters(parser));
        }
        if (peek(parser).isOperator("[")) {
            throw parser.error(peek(parser), "Array declarators are not supported");
        }
        return new DeclarationNode(name, type, null, location);
    }

    private static List<DeclarationNode> parseParameters(Parser parser) {
        List<DeclarationNode> parameters = new ArrayList<>();
        if (consumeIfOperator(parser, ")")) {
            return parameters;
        }
        do {
            SourceLocation location = parser.location(peek(parser));
            TypeDescriptor base = parseTypeSpecifier(parser);
            parameters.add(parseDeclarator(parser, base, location, true));
        } while (consumeIfOperator(parser, ","));
        consume(parser, LexerTokenType.OPERATOR, ")");
        return parameters;
    }
}
