package org.athos.cfg;

import org.athos.astnode.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a linear slice of a control-flow graph (a single path, as extracted
 * with {@link ControlFlowGraph#subgraphBetween}) back into nested statements.
 * <p>
 * Each guard vertex opens a new sequence that becomes the body of the
 * rebuilt construct, so only one branch per construct can be represented:
 * else branches and sibling sequences are out of reach.
 */
public final class PathReconstructor {

    private PathReconstructor() {
    }

    /**
     * Rebuilds statements from a linear graph.
     *
     * @param path a graph forming a single chain
     * @return the outermost sequence
     */
    public static BlockNode reconstruct(ControlFlowGraph path) {
        List<Node> order = path.topologicalOrder();
        SourceLocation location = order.isEmpty() ? SourceLocation.UNKNOWN : order.get(0).getLocation();

        BlockNode root = new BlockNode(location);
        BlockNode current = root;
        for (Node node : order) {
            if (node instanceof FunctionDefinitionNode function) {
                BlockNode previous = current;
                current = new BlockNode(function.location);
                previous.elements.add(new FunctionDefinitionNode(function.signature, current, function.location));
            } else if (node instanceof WhileNode loop) {
                BlockNode previous = current;
                current = new BlockNode(loop.location);
                previous.elements.add(new WhileNode(loop.condition, current, loop.location));
            } else if (node instanceof IfNode conditional) {
                BlockNode previous = current;
                current = new BlockNode(conditional.location);
                previous.elements.add(new IfNode(conditional.condition, current, null, conditional.location));
            } else if (!(node instanceof MarkerNode)) {
                current.elements.add(node);
            }
        }
        return root;
    }

    /**
     * Returns the conditions governing one execution path: the {@link IfNode}
     * guards of {@code path}, in topological order, chained into a new graph.
     */
    public static ControlFlowGraph ifPath(ControlFlowGraph path) {
        List<Node> guards = new ArrayList<>();
        for (Node node : path.topologicalOrder()) {
            if (node instanceof IfNode) {
                guards.add(node);
            }
        }

        ControlFlowGraph result = new ControlFlowGraph();
        Node previous = null;
        for (Node guard : guards) {
            result.addNode(guard);
            if (previous != null) {
                result.addEdge(previous, guard);
            }
            previous = guard;
        }
        return result;
    }
}
