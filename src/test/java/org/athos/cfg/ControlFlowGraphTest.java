package org.athos.cfg;

import org.athos.astnode.IdentifierNode;
import org.athos.astnode.Node;
import org.athos.astnode.SourceLocation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ControlFlowGraphTest {

    private static IdentifierNode vertex(String name, int line) {
        return new IdentifierNode(name, new SourceLocation("graph.c", line));
    }

    @Test
    public void testEdges() {
        ControlFlowGraph graph = new ControlFlowGraph();
        IdentifierNode a = vertex("a", 1);
        IdentifierNode b = vertex("b", 2);

        graph.addEdge(a, b);
        assertTrue(graph.containsNode(a));
        assertTrue(graph.containsNode(b));
        assertEquals(Set.of(b), graph.successors(a));
        assertEquals(Set.of(a), graph.predecessors(b));

        graph.removeEdge(a, b);
        assertFalse(graph.containsEdge(a, b));
        assertEquals(2, graph.size());
        assertThrows(IllegalArgumentException.class, () -> graph.successors(vertex("c", 3)));
    }

    @Test
    public void testVerticesAreKeyedByIdentity() {
        ControlFlowGraph graph = new ControlFlowGraph();
        graph.addNode(vertex("x", 1));
        graph.addNode(vertex("x", 1));
        assertEquals(2, graph.size());
    }

    @Test
    public void testTopologicalOrderPrefersInsertionOrder() {
        ControlFlowGraph graph = new ControlFlowGraph();
        IdentifierNode a = vertex("a", 1);
        IdentifierNode b = vertex("b", 2);
        IdentifierNode c = vertex("c", 3);
        graph.addNode(a);
        graph.addNode(b);
        graph.addNode(c);
        graph.addEdge(c, a);

        assertEquals(List.of(b, c, a), graph.topologicalOrder());
    }

    @Test
    public void testTopologicalOrderRejectsCycles() {
        ControlFlowGraph graph = new ControlFlowGraph();
        IdentifierNode a = vertex("a", 1);
        IdentifierNode b = vertex("b", 2);
        graph.addEdge(a, b);
        graph.addEdge(b, a);

        assertThrows(IllegalStateException.class, graph::topologicalOrder);
    }

    @Test
    public void testSubgraphBetweenStopsAtEnd() {
        ControlFlowGraph graph = new ControlFlowGraph();
        IdentifierNode a = vertex("a", 1);
        IdentifierNode b = vertex("b", 2);
        IdentifierNode c = vertex("c", 3);
        IdentifierNode d = vertex("d", 4);
        IdentifierNode side = vertex("side", 5);
        graph.addEdge(a, b);
        graph.addEdge(b, c);
        graph.addEdge(c, d);
        graph.addEdge(b, side);

        ControlFlowGraph subgraph = graph.subgraphBetween(a, c);

        assertEquals(Set.of(a, b, c, side), subgraph.nodes());
        assertFalse(subgraph.containsNode(d));
        assertTrue(subgraph.containsEdge(a, b));
        assertTrue(subgraph.containsEdge(b, side));
        assertEquals(3, subgraph.edgeCount());
    }

    @Test
    public void testSubgraphBetweenAlwaysContainsEnd() {
        ControlFlowGraph graph = new ControlFlowGraph();
        IdentifierNode a = vertex("a", 1);
        IdentifierNode b = vertex("b", 2);
        IdentifierNode unreachable = vertex("z", 9);
        graph.addEdge(a, b);
        graph.addNode(unreachable);

        ControlFlowGraph subgraph = graph.subgraphBetween(a, unreachable);

        assertEquals(3, subgraph.size());
        assertTrue(subgraph.successors(unreachable).isEmpty());
        assertTrue(subgraph.predecessors(unreachable).isEmpty());
    }

    @Test
    public void testSubgraphBetweenSameVertex() {
        ControlFlowGraph graph = new ControlFlowGraph();
        IdentifierNode a = vertex("a", 1);
        graph.addEdge(a, vertex("b", 2));

        assertEquals(Set.of(a), graph.subgraphBetween(a, a).nodes());
    }

    @Test
    public void testSubgraphBetweenTerminatesOnCycles() {
        ControlFlowGraph graph = new ControlFlowGraph();
        IdentifierNode a = vertex("a", 1);
        IdentifierNode b = vertex("b", 2);
        IdentifierNode c = vertex("c", 3);
        graph.addEdge(a, b);
        graph.addEdge(b, a);
        graph.addEdge(b, c);

        ControlFlowGraph subgraph = graph.subgraphBetween(a, c);
        assertEquals(3, subgraph.size());
        assertTrue(subgraph.containsEdge(b, a));
    }

    @Test
    public void testDeepCopy() {
        ControlFlowGraph graph = new ControlFlowGraph();
        IdentifierNode a = vertex("a", 1);
        IdentifierNode b = vertex("b", 2);
        graph.addEdge(a, b);

        ControlFlowGraph copy = graph.deepCopy();

        assertEquals(2, copy.size());
        assertEquals(1, copy.edgeCount());
        assertFalse(copy.containsNode(a));
        assertFalse(copy.containsNode(b));
        List<Node> order = copy.topologicalOrder();
        assertEquals("a", ((IdentifierNode) order.get(0)).name);
        assertEquals("b", ((IdentifierNode) order.get(1)).name);
    }

    @Test
    public void testInsertGraphLeavesCopyDangling() {
        ControlFlowGraph graph = new ControlFlowGraph();
        IdentifierNode place = vertex("p", 1);
        IdentifierNode after = vertex("q", 2);
        graph.addEdge(place, after);

        ControlFlowGraph inserted = new ControlFlowGraph();
        IdentifierNode x = vertex("x", 10);
        IdentifierNode y = vertex("y", 11);
        inserted.addEdge(x, y);

        graph.insertGraph(place, inserted);

        assertEquals(4, graph.size());
        assertFalse(graph.containsEdge(place, after));
        assertTrue(graph.predecessors(after).isEmpty());
        assertFalse(graph.containsNode(x));
        assertFalse(graph.containsNode(y));

        Node first = graph.successors(place).iterator().next();
        assertEquals("x", ((IdentifierNode) first).name);
        Node last = graph.successors(first).iterator().next();
        assertEquals("y", ((IdentifierNode) last).name);
        assertTrue(graph.successors(last).isEmpty());

        // The inserted graph itself is untouched
        assertEquals(Set.of(x, y), inserted.nodes());
    }

    @Test
    public void testInsertEmptyGraph() {
        ControlFlowGraph graph = new ControlFlowGraph();
        IdentifierNode place = vertex("p", 1);
        IdentifierNode after = vertex("q", 2);
        graph.addEdge(place, after);

        graph.insertGraph(place, new ControlFlowGraph());

        assertTrue(graph.containsEdge(place, after));
    }

    @Test
    public void testToDot() {
        ControlFlowGraph graph = new ControlFlowGraph();
        graph.addEdge(vertex("a", 1), vertex("b", 2));

        String dot = graph.toDot();

        assertTrue(dot.startsWith("digraph cfg {\n"));
        assertTrue(dot.contains("n0 [label=\"IdentifierNode graph.c:1\"];"));
        assertTrue(dot.contains("n0 -> n1;"));
        assertTrue(dot.endsWith("}\n"));
    }
}
