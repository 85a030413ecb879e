package org.athos.unfold;

import org.athos.astnode.*;
import org.athos.astvisitor.CodeGeneratorVisitor;
import org.athos.astvisitor.MainLoopFinder;
import org.athos.parser.Parser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LoopUnfolderTest {

    private static final SyncVariables SYNC = new SyncVariables("round", "mbox");

    private static final String TWO_HANDLERS = String.join("\n",
            "enum round_typ round;",
            "void *mbox;",
            "int main()",
            "{",
            "  while (1)",
            "  {",
            "    mbox = havoc(round);",
            "    if (round == 1)",
            "    {",
            "      round = 3;",
            "      continue;",
            "    }",
            "    if (round == 2)",
            "    {",
            "      round = 4;",
            "      continue;",
            "    }",
            "  }",
            "}",
            "");

    @Test
    public void testUnfoldOnce() {
        BlockNode ast = Parser.parse("loop.c", TWO_HANDLERS);
        LoopUnfolder.unfold(ast, 1, SYNC);

        String expected = String.join("\n",
                "enum round_typ round_0;",
                "enum round_typ round_1;",
                "enum round_typ round;",
                "void *mbox_0;",
                "void *mbox_1;",
                "void *mbox;",
                "int main()",
                "{",
                "  while (1)",
                "  {",
                "    mbox = havoc(round);",
                "    if (round == 1)",
                "    {",
                "      round_0 = 3;",
                "      mbox_0 = havoc(round_0);",
                "      if (round_0 == 1)",
                "      {",
                "        round_1 = 3;",
                "        continue;",
                "      }",
                "      if (round_0 == 2)",
                "      {",
                "        round_1 = 4;",
                "        continue;",
                "      }",
                "      continue;",
                "    }",
                "    if (round == 2)",
                "    {",
                "      round_0 = 4;",
                "      mbox_0 = havoc(round_0);",
                "      if (round_0 == 1)",
                "      {",
                "        round_1 = 3;",
                "        continue;",
                "      }",
                "      if (round_0 == 2)",
                "      {",
                "        round_1 = 4;",
                "        continue;",
                "      }",
                "      continue;",
                "    }",
                "  }",
                "}",
                "",
                "");
        assertEquals(expected, CodeGeneratorVisitor.generate(ast));
    }

    @Test
    public void testUnfoldTwiceNestsAndLagsMailbox() {
        BlockNode ast = Parser.parse("loop.c", TWO_HANDLERS);
        LoopUnfolder.unfold(ast, 2, SYNC);

        IfNode handler = handlers(loopBody(ast)).get(0);
        BlockNode level0 = (BlockNode) handler.thenBranch;
        assertEquals("round_0 = 3", CodeGeneratorVisitor.generate(level0.elements.get(0)));
        assertEquals("mbox_0 = havoc(round_0)", CodeGeneratorVisitor.generate(level0.elements.get(1)));

        IfNode nested = handlers(level0.elements).get(0);
        assertEquals("round_0 == 1", CodeGeneratorVisitor.generate(nested.condition));
        BlockNode level1 = (BlockNode) nested.thenBranch;
        // Second iteration enters round 1 and receives mbox_1
        assertEquals("round_1 = 3", CodeGeneratorVisitor.generate(level1.elements.get(0)));
        assertEquals("mbox_1 = havoc(round_1)", CodeGeneratorVisitor.generate(level1.elements.get(1)));

        IfNode innermost = handlers(level1.elements).get(1);
        assertEquals("round_1 == 2", CodeGeneratorVisitor.generate(innermost.condition));
        BlockNode level2 = (BlockNode) innermost.thenBranch;
        assertEquals(2, level2.elements.size());
        assertEquals("round_2 = 4", CodeGeneratorVisitor.generate(level2.elements.get(0)));
        assertInstanceOf(ContinueNode.class, level2.elements.get(1));

        String code = CodeGeneratorVisitor.generate(ast);
        assertTrue(code.contains("enum round_typ round_2;"));
        assertTrue(code.contains("void *mbox_2;"));
        assertFalse(code.contains("round_3"));
    }

    @Test
    public void testDepthGrowsWithUnfoldings() {
        for (int k = 1; k <= 3; k++) {
            BlockNode ast = Parser.parse("loop.c", TWO_HANDLERS);
            LoopUnfolder.unfold(ast, k, SYNC);
            assertEquals(k + 1, handlerDepth(loopBody(ast)), "handler nesting for k=" + k);
        }
    }

    @Test
    public void testTopLevelStatementsAreNotRenamed() {
        BlockNode ast = Parser.parse("loop.c", TWO_HANDLERS);
        LoopUnfolder.unfold(ast, 1, SYNC);

        List<Node> body = loopBody(ast);
        assertEquals("mbox = havoc(round)", CodeGeneratorVisitor.generate(body.get(0)));
        assertEquals("round == 1", CodeGeneratorVisitor.generate(handlers(body).get(0).condition));
    }

    @Test
    public void testHandlerWithoutContinueIsLeftAlone() {
        String code = String.join("\n",
                "enum round_typ round;",
                "void *mbox;",
                "int main()",
                "{",
                "  while (1)",
                "  {",
                "    mbox = havoc(round);",
                "    if (round == 1)",
                "    {",
                "      round = 3;",
                "    }",
                "  }",
                "}",
                "");
        BlockNode ast = Parser.parse("loop.c", code);
        LoopUnfolder.unfold(ast, 1, SYNC);

        BlockNode branch = (BlockNode) handlers(loopBody(ast)).get(0).thenBranch;
        assertEquals(1, branch.elements.size());
        assertEquals("round_0 = 3", CodeGeneratorVisitor.generate(branch.elements.get(0)));
    }

    @Test
    public void testContinueInsideElseBranchIsExpanded() {
        String code = String.join("\n",
                "enum round_typ round;",
                "void *mbox;",
                "int main()",
                "{",
                "  while (1)",
                "  {",
                "    mbox = havoc(round);",
                "    if (round == 1)",
                "    {",
                "      if (mbox == 0)",
                "      {",
                "        round = 2;",
                "      }",
                "      else",
                "      {",
                "        round = 3;",
                "        continue;",
                "      }",
                "    }",
                "  }",
                "}",
                "");
        BlockNode ast = Parser.parse("loop.c", code);
        LoopUnfolder.unfold(ast, 1, SYNC);

        BlockNode branch = (BlockNode) handlers(loopBody(ast)).get(0).thenBranch;
        IfNode inner = (IfNode) branch.elements.get(0);
        BlockNode elseBlock = (BlockNode) inner.elseBranch;
        // round = 3; then the spliced copy of the two loop statements, then continue
        assertEquals(4, elseBlock.elements.size());
        assertEquals("mbox_0 = havoc(round_0)", CodeGeneratorVisitor.generate(elseBlock.elements.get(1)));
        assertInstanceOf(ContinueNode.class, elseBlock.elements.get(3));
        assertEquals(1, ((BlockNode) inner.thenBranch).elements.size());
    }

    @Test
    public void testSplicedCopiesAreIndependent() {
        BlockNode ast = Parser.parse("loop.c", TWO_HANDLERS);
        LoopUnfolder.unfold(ast, 1, SYNC);

        List<IfNode> top = handlers(loopBody(ast));
        Node first = ((BlockNode) top.get(0).thenBranch).elements.get(1);
        Node second = ((BlockNode) top.get(1).thenBranch).elements.get(1);
        assertNotSame(first, second);
        assertEquals(CodeGeneratorVisitor.generate(first), CodeGeneratorVisitor.generate(second));
    }

    @Test
    public void testNoMainLoop() {
        BlockNode ast = Parser.parse("noloop.c", "int main()\n{\n  return 0;\n}\n");
        assertThrows(PreconditionException.class, () -> LoopUnfolder.unfold(ast, 1, SYNC));
    }

    @Test
    public void testLoopBodyMustBeBlock() {
        BlockNode ast = Parser.parse("single.c", "int main()\n{\n  while (1)\n    x = 1;\n}\n");
        PreconditionException e = assertThrows(PreconditionException.class, () -> LoopUnfolder.unfold(ast, 1, SYNC));
        assertTrue(e.getMessage().contains("compound statement"));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    public void testUnfoldingsMustBePositive(int k) {
        BlockNode ast = Parser.parse("loop.c", TWO_HANDLERS);
        assertThrows(IllegalArgumentException.class, () -> LoopUnfolder.unfold(ast, k, SYNC));
    }

    private static List<Node> loopBody(Node ast) {
        return ((BlockNode) MainLoopFinder.find(ast).body).elements;
    }

    private static List<IfNode> handlers(List<Node> statements) {
        List<IfNode> result = new ArrayList<>();
        for (Node statement : statements) {
            if (statement instanceof IfNode handler) {
                result.add(handler);
            }
        }
        return result;
    }

    private static int handlerDepth(List<Node> statements) {
        int depth = 0;
        for (IfNode handler : handlers(statements)) {
            if (handler.thenBranch instanceof BlockNode block) {
                depth = Math.max(depth, 1 + handlerDepth(block.elements));
            }
        }
        return depth;
    }
}
