package org.athos.cfg;

import org.athos.astnode.*;
import org.athos.astvisitor.Visitor;

/**
 * Translates an AST into a control-flow graph, one region per node.
 * <p>
 * Branching constructs get synthetic {@link MarkerNode}s so that every
 * region has a single entry and a single exit:
 * <pre>
 *   if (c) T else F      ENTRY -> if(c) -> T -> EXIT
 *                        ENTRY -> if(!c) -> F -> EXIT
 *                        ENTRY -> EXIT
 *
 *   while (c) B          while(c) -> B -> LOOP_EXIT
 *                        while(c) -> LOOP_EXIT
 * </pre>
 * The {@code ENTRY -> EXIT} edge is added even when an else branch exists.
 * No back-edge is added for loops: a path through the graph covers at most
 * one iteration of each loop.
 * <p>
 * Guard vertices are new {@link IfNode}/{@link WhileNode} instances with
 * null bodies; they share the condition expression of the source node.
 * Every other kind (statements, expressions, declarations) is a single vertex.
 */
public class ControlFlowGraphBuilder implements Visitor {
    private static final boolean DEBUG_CFG = Boolean.getBoolean("athos.debug.cfg");

    private final ControlFlowGraph graph;
    private Region result;

    public ControlFlowGraphBuilder(ControlFlowGraph graph) {
        this.graph = graph;
    }

    /**
     * Translates {@code node} into vertices and edges of the graph.
     *
     * @param node the AST node to translate
     * @return the entry/exit pair of the translated region
     */
    public Region build(Node node) {
        node.accept(this);
        Region region = result;
        result = null;
        if (DEBUG_CFG) {
            System.err.println("DEBUG: cfg " + node.getClass().getSimpleName() + " " + node.getLocation() + " -> " + region);
        }
        return region;
    }

    /**
     * Connects {@code from} to the entry of {@code region} and returns the
     * node to continue from: the region's exit, or {@code from} itself when
     * the region is empty.
     */
    private Node chain(Node from, Region region) {
        if (region.isEmpty()) {
            return from;
        }
        graph.addEdge(from, region.first);
        return region.last;
    }

    private void leaf(Node node) {
        graph.addNode(node);
        result = new Region(node, node);
    }

    @Override
    public void visit(IfNode node) {
        MarkerNode entry = new MarkerNode(MarkerNode.Kind.CONDITIONAL_ENTRY, node.location.withTag("START"));
        MarkerNode exit = new MarkerNode(MarkerNode.Kind.CONDITIONAL_EXIT, node.location.withTag("END"));
        graph.addNode(exit);

        Region thenRegion = build(node.thenBranch);
        IfNode thenGuard = new IfNode(node.condition, null, null, node.location);
        graph.addNode(entry);
        graph.addEdge(entry, thenGuard);
        graph.addEdge(chain(thenGuard, thenRegion), exit);

        if (node.elseBranch != null) {
            IfNode elseGuard = new IfNode(
                    new UnaryOperatorNode("!", node.condition, false, node.condition.getLocation()),
                    null, null, node.location);
            graph.addEdge(entry, elseGuard);
            Region elseRegion = build(node.elseBranch);
            graph.addEdge(chain(elseGuard, elseRegion), exit);
        }

        graph.addEdge(entry, exit);
        result = new Region(entry, exit);
    }

    @Override
    public void visit(WhileNode node) {
        Region bodyRegion = build(node.body);

        WhileNode guard = new WhileNode(node.condition, null, node.location);
        MarkerNode exit = new MarkerNode(MarkerNode.Kind.LOOP_EXIT, node.location.withTag("END"));
        graph.addNode(guard);

        graph.addEdge(chain(guard, bodyRegion), exit);
        graph.addEdge(guard, exit);
        result = new Region(guard, exit);
    }

    @Override
    public void visit(BlockNode node) {
        Node first = null;
        Node previousLast = null;
        for (Node element : node.elements) {
            Region region = build(element);
            if (region.isEmpty()) {
                continue;
            }
            if (previousLast != null) {
                graph.addEdge(previousLast, region.first);
            }
            if (first == null) {
                first = region.first;
            }
            previousLast = region.last;
        }
        result = first == null ? Region.EMPTY : new Region(first, previousLast);
    }

    @Override
    public void visit(FunctionDefinitionNode node) {
        Region bodyRegion = node.body == null ? Region.EMPTY : build(node.body);

        FunctionDefinitionNode entry = new FunctionDefinitionNode(node.signature, null, node.location);
        MarkerNode exit = new MarkerNode(MarkerNode.Kind.FUNCTION_EXIT, node.location.withTag("END"));
        graph.addNode(entry);

        graph.addEdge(chain(entry, bodyRegion), exit);
        result = new Region(entry, exit);
    }

    @Override
    public void visit(ContinueNode node) {
        leaf(node);
    }

    @Override
    public void visit(BreakNode node) {
        leaf(node);
    }

    @Override
    public void visit(ReturnNode node) {
        leaf(node);
    }

    @Override
    public void visit(EmptyStatementNode node) {
        leaf(node);
    }

    @Override
    public void visit(AssignmentNode node) {
        leaf(node);
    }

    @Override
    public void visit(DeclarationNode node) {
        leaf(node);
    }

    @Override
    public void visit(IdentifierNode node) {
        leaf(node);
    }

    @Override
    public void visit(ConstantNode node) {
        leaf(node);
    }

    @Override
    public void visit(FunctionCallNode node) {
        leaf(node);
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        leaf(node);
    }

    @Override
    public void visit(UnaryOperatorNode node) {
        leaf(node);
    }

    @Override
    public void visit(StructRefNode node) {
        leaf(node);
    }

    @Override
    public void visit(MarkerNode node) {
        leaf(node);
    }
}
