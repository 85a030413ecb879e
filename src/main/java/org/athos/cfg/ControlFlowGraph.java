package org.athos.cfg;

import org.athos.astnode.MarkerNode;
import org.athos.astnode.Node;
import org.athos.astvisitor.CloneVisitor;

import java.util.*;

/**
 * A directed graph whose vertices are AST nodes, keyed by identity, and
 * whose edges denote possible single-step execution order.
 * <p>
 * Vertices and edges are kept in insertion order, which makes every
 * iteration (and {@link #topologicalOrder()}) deterministic. The graph may
 * contain cycles.
 */
public class ControlFlowGraph {
    private final Map<Node, Set<Node>> successors = new LinkedHashMap<>();
    private final Map<Node, Set<Node>> predecessors = new LinkedHashMap<>();

    /**
     * Builds the control-flow graph of an AST.
     *
     * @param ast the root to translate
     * @return a new graph
     */
    public static ControlFlowGraph fromAst(Node ast) {
        ControlFlowGraph graph = new ControlFlowGraph();
        new ControlFlowGraphBuilder(graph).build(ast);
        return graph;
    }

    public void addNode(Node node) {
        Objects.requireNonNull(node, "node");
        successors.computeIfAbsent(node, k -> new LinkedHashSet<>());
        predecessors.computeIfAbsent(node, k -> new LinkedHashSet<>());
    }

    /**
     * Adds an edge, adding missing endpoints first.
     */
    public void addEdge(Node from, Node to) {
        addNode(from);
        addNode(to);
        successors.get(from).add(to);
        predecessors.get(to).add(from);
    }

    public void removeEdge(Node from, Node to) {
        Set<Node> out = successors.get(from);
        if (out != null && out.remove(to)) {
            predecessors.get(to).remove(from);
        }
    }

    public boolean containsNode(Node node) {
        return successors.containsKey(node);
    }

    public boolean containsEdge(Node from, Node to) {
        Set<Node> out = successors.get(from);
        return out != null && out.contains(to);
    }

    public Set<Node> nodes() {
        return Collections.unmodifiableSet(successors.keySet());
    }

    public Set<Node> successors(Node node) {
        return Collections.unmodifiableSet(requireNode(node, successors));
    }

    public Set<Node> predecessors(Node node) {
        return Collections.unmodifiableSet(requireNode(node, predecessors));
    }

    public int size() {
        return successors.size();
    }

    public boolean isEmpty() {
        return successors.isEmpty();
    }

    public int edgeCount() {
        int count = 0;
        for (Set<Node> out : successors.values()) {
            count += out.size();
        }
        return count;
    }

    private static Set<Node> requireNode(Node node, Map<Node, Set<Node>> adjacency) {
        Set<Node> set = adjacency.get(node);
        if (set == null) {
            throw new IllegalArgumentException("Node is not in the graph: " + node.getLocation());
        }
        return set;
    }

    /**
     * Returns true if {@code to} can be reached from {@code from} following
     * zero or more edges.
     */
    public boolean isReachable(Node from, Node to) {
        if (!containsNode(from)) {
            return false;
        }
        Set<Node> seen = new HashSet<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(from);
        while (!stack.isEmpty()) {
            Node current = stack.pop();
            if (current == to) {
                return true;
            }
            if (seen.add(current)) {
                for (Node next : successors.get(current)) {
                    stack.push(next);
                }
            }
        }
        return false;
    }

    /**
     * Returns the vertices in topological order. Among vertices that are
     * ready at the same time, the one inserted first comes first.
     *
     * @throws IllegalStateException if the graph has a cycle
     */
    public List<Node> topologicalOrder() {
        Map<Node, Integer> inDegree = new HashMap<>();
        for (Map.Entry<Node, Set<Node>> entry : predecessors.entrySet()) {
            inDegree.put(entry.getKey(), entry.getValue().size());
        }

        // Ready vertices ordered by insertion position
        Map<Node, Integer> position = new HashMap<>();
        int index = 0;
        for (Node node : successors.keySet()) {
            position.put(node, index++);
        }
        PriorityQueue<Node> ready = new PriorityQueue<>(Comparator.comparingInt(position::get));
        for (Node node : successors.keySet()) {
            if (inDegree.get(node) == 0) {
                ready.add(node);
            }
        }

        List<Node> order = new ArrayList<>(successors.size());
        while (!ready.isEmpty()) {
            Node node = ready.poll();
            order.add(node);
            for (Node next : successors.get(node)) {
                int remaining = inDegree.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(next);
                }
            }
        }
        if (order.size() != successors.size()) {
            throw new IllegalStateException("Control-flow graph has a cycle");
        }
        return order;
    }

    /**
     * Returns the subgraph induced by every vertex discovered by a forward
     * search from {@code start} that never expands {@code end}.
     * <p>
     * This is a reachability envelope: {@code end} is always part of the
     * result, even when the search never reaches it, and vertices that do
     * not lie on a path to {@code end} may be included.
     */
    public ControlFlowGraph subgraphBetween(Node start, Node end) {
        Set<Node> found = new HashSet<>();
        found.add(start);

        Set<Node> frontier = new LinkedHashSet<>();
        frontier.add(start);
        while (!frontier.isEmpty()) {
            Set<Node> current = frontier;
            frontier = new LinkedHashSet<>();
            for (Node node : current) {
                if (node != end && containsNode(node)) {
                    for (Node next : successors.get(node)) {
                        // Already discovered vertices are not expanded twice
                        if (found.add(next)) {
                            frontier.add(next);
                        }
                    }
                }
            }
        }
        found.add(end);

        return inducedSubgraph(found);
    }

    private ControlFlowGraph inducedSubgraph(Set<Node> vertices) {
        ControlFlowGraph subgraph = new ControlFlowGraph();
        for (Node node : successors.keySet()) {
            if (vertices.contains(node)) {
                subgraph.addNode(node);
            }
        }
        // Vertices outside this graph (an unreached end) are still included
        for (Node node : vertices) {
            if (!containsNode(node)) {
                subgraph.addNode(node);
            }
        }
        for (Node node : successors.keySet()) {
            if (!vertices.contains(node)) {
                continue;
            }
            for (Node next : successors.get(node)) {
                if (vertices.contains(next)) {
                    subgraph.addEdge(node, next);
                }
            }
        }
        return subgraph;
    }

    /**
     * Returns a deep copy: every vertex is cloned and edges are mapped onto
     * the clones.
     */
    public ControlFlowGraph deepCopy() {
        Map<Node, Node> copies = new HashMap<>();
        ControlFlowGraph copy = new ControlFlowGraph();
        for (Node node : successors.keySet()) {
            Node clone = CloneVisitor.clone(node);
            copies.put(node, clone);
            copy.addNode(clone);
        }
        for (Map.Entry<Node, Set<Node>> entry : successors.entrySet()) {
            for (Node next : entry.getValue()) {
                copy.addEdge(copies.get(entry.getKey()), copies.get(next));
            }
        }
        return copy;
    }

    /**
     * Inserts a deep copy of {@code graph} after {@code place}: all outgoing
     * edges of {@code place} are removed and an edge to the topologically
     * first vertex of the copy is added.
     * <p>
     * The last vertex of the copy is left without successors, so the
     * inserted region ends the branch; the former successors of
     * {@code place} are not reconnected.
     */
    public void insertGraph(Node place, ControlFlowGraph graph) {
        if (graph.isEmpty()) {
            return;
        }
        ControlFlowGraph copy = graph.deepCopy();
        for (Node node : copy.successors.keySet()) {
            addNode(node);
        }
        for (Map.Entry<Node, Set<Node>> entry : copy.successors.entrySet()) {
            for (Node next : entry.getValue()) {
                addEdge(entry.getKey(), next);
            }
        }

        Node first = copy.topologicalOrder().get(0);

        addNode(place);
        for (Node oldSuccessor : new ArrayList<>(successors.get(place))) {
            removeEdge(place, oldSuccessor);
        }
        addEdge(place, first);
    }

    /**
     * Renders the graph in Graphviz DOT syntax. Each vertex is labeled with
     * its node kind and source location.
     */
    public String toDot() {
        Map<Node, String> ids = new HashMap<>();
        StringBuilder sb = new StringBuilder("digraph cfg {\n");
        int index = 0;
        for (Node node : successors.keySet()) {
            String id = "n" + index++;
            ids.put(node, id);
            sb.append("  ").append(id).append(" [label=\"").append(label(node)).append("\"];\n");
        }
        for (Map.Entry<Node, Set<Node>> entry : successors.entrySet()) {
            for (Node next : entry.getValue()) {
                sb.append("  ").append(ids.get(entry.getKey())).append(" -> ").append(ids.get(next)).append(";\n");
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String label(Node node) {
        String kind = node instanceof MarkerNode marker ? marker.kind.toString() : node.getClass().getSimpleName();
        return (kind + " " + node.getLocation()).replace("\"", "\\\"");
    }
}
