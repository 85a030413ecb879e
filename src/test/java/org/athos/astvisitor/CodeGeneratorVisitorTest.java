package org.athos.astvisitor;

import org.athos.astnode.*;
import org.athos.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CodeGeneratorVisitorTest {

    private static String roundTrip(String code) {
        return CodeGeneratorVisitor.generate(Parser.parse("gen.c", code));
    }

    @Test
    public void testPrintsFunction() {
        String code = String.join("\n",
                "int main()",
                "{",
                "  int x = 1;",
                "  while (x)",
                "  {",
                "    if (x == 1)",
                "      x = 2;",
                "    else",
                "    {",
                "      break;",
                "    }",
                "  }",
                "  return x;",
                "}",
                "",
                "");
        assertEquals(code, roundTrip(code));
    }

    @Test
    public void testParenthesizesNestedBinaryOperands() {
        assertTrue(roundTrip("int main()\n{\n  a = (b + c) * d;\n}\n").contains("  a = (b + c) * d;\n"));
        BinaryOperatorNode sum = new BinaryOperatorNode("+",
                new BinaryOperatorNode("*", new IdentifierNode("a", SourceLocation.UNKNOWN),
                        new IdentifierNode("b", SourceLocation.UNKNOWN), SourceLocation.UNKNOWN),
                new ConstantNode("1", SourceLocation.UNKNOWN), SourceLocation.UNKNOWN);
        assertEquals("(a * b) + 1", CodeGeneratorVisitor.generate(sum));
    }

    @Test
    public void testDeclarations() {
        String code = String.join("\n",
                "struct list",
                "{",
                "  struct msg *message;",
                "  int size;",
                "};",
                "enum phase",
                "{",
                "  A,",
                "  B = 3",
                "};",
                "struct list *havoc(int view, enum phase round);",
                "unsigned long counter;",
                "");
        assertEquals(code, roundTrip(code));
    }

    @Test
    public void testDeclarationText() {
        DeclarationNode declaration = new DeclarationNode("mbox",
                new PointerType(new StructType("list", null)), null, SourceLocation.UNKNOWN);
        assertEquals("struct list *mbox", CodeGeneratorVisitor.declarationText(declaration));

        DeclarationNode prototype = new DeclarationNode("f",
                new FunctionType(new PointerType(new NamedType(List.of("void"))),
                        List.of(new DeclarationNode(null, new NamedType(List.of("int")), null, SourceLocation.UNKNOWN))),
                null, SourceLocation.UNKNOWN);
        assertEquals("void *f(int)", CodeGeneratorVisitor.declarationText(prototype));
    }

    @Test
    public void testExpressions() {
        String code = "int main()\n{\n  m->size++;\n  x = -y;\n  p.next = f(g(1), 'c', \"s\");\n}\n";
        String generated = roundTrip(code);
        assertTrue(generated.contains("  m->size++;\n"));
        assertTrue(generated.contains("  x = -y;\n"));
        assertTrue(generated.contains("  p.next = f(g(1), 'c', \"s\");\n"));
    }

    @Test
    public void testNestedUnaryOperators() {
        String generated = roundTrip("int main()\n{\n  x = - -y;\n  (*p)++;\n  z = !!f(a);\n  q = *s->next;\n}\n");

        assertTrue(generated.contains("  x = -(-y);\n"));
        assertTrue(generated.contains("  (*p)++;\n"));
        assertTrue(generated.contains("  z = !(!f(a));\n"));
        assertTrue(generated.contains("  q = *s->next;\n"));
        // Printing twice gives the same text
        assertEquals(generated, roundTrip(generated));
    }

    @Test
    public void testElseStaysWithOuterConditional() {
        SourceLocation location = SourceLocation.UNKNOWN;
        IfNode inner = new IfNode(new IdentifierNode("b", location),
                new AssignmentNode("=", new IdentifierNode("x", location), new ConstantNode("1", location), location),
                null, location);
        IfNode outer = new IfNode(new IdentifierNode("a", location), inner,
                new AssignmentNode("=", new IdentifierNode("x", location), new ConstantNode("2", location), location),
                location);

        String generated = CodeGeneratorVisitor.generate(outer);

        assertEquals(String.join("\n",
                "if (a)",
                "{",
                "  if (b)",
                "    x = 1;",
                "}",
                "else",
                "  x = 2;",
                ""), generated);

        BlockNode reparsed = Parser.parse("gen.c", "int main()\n{\n" + generated + "}\n");
        IfNode conditional = (IfNode) ((FunctionDefinitionNode) reparsed.elements.get(0)).body.elements.get(0);
        assertNotNull(conditional.elseBranch);
        assertNull(((IfNode) ((BlockNode) conditional.thenBranch).elements.get(0)).elseBranch);
    }

    @Test
    public void testInnerElseNeedsNoBraces() {
        String code = String.join("\n",
                "int main()",
                "{",
                "  if (a)",
                "    if (b)",
                "      x = 1;",
                "    else",
                "      x = 2;",
                "}",
                "",
                "");
        assertEquals(code, roundTrip(code));
    }

    @Test
    public void testMarkersPrintNothing() {
        assertEquals("", CodeGeneratorVisitor.generate(
                new MarkerNode(MarkerNode.Kind.LOOP_EXIT, SourceLocation.UNKNOWN)));
    }

    @Test
    public void testPrintVisitorOutline() {
        Node node = new ReturnNode(new IdentifierNode("x", new SourceLocation("gen.c", 3)), new SourceLocation("gen.c", 3));
        String outline = node.toString();
        assertTrue(outline.startsWith("ReturnNode"));
        assertTrue(outline.contains("gen.c:3"));
        assertTrue(outline.contains("x"));
    }
}
