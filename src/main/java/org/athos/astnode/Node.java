package org.athos.astnode;

import org.athos.astvisitor.Visitor;

/**
 * The Node interface represents a node in the abstract syntax tree (AST).
 * Every statement and expression of the C source implements it, as do the
 * synthetic markers added while building a control-flow graph.
 * <p>
 * Nodes compare by identity: two structurally identical nodes are distinct
 * entities when they are distinct copies. Graphs and maps key on the node
 * object itself.
 */
public interface Node {

    /**
     * Accepts a visitor that performs some operation on this node.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    void accept(Visitor visitor);

    /**
     * Returns the source coordinate of this node, used for labeling only.
     *
     * @return the source location, never null
     */
    SourceLocation getLocation();
}
