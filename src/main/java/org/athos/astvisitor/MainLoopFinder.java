package org.athos.astvisitor;

import org.athos.astnode.Node;
import org.athos.astnode.WhileNode;

/**
 * Finds the event loop of a program: the first {@code while} statement met
 * by a pre-order walk. Loops nested inside it are not considered.
 */
public class MainLoopFinder extends DepthFirstVisitor {
    private WhileNode result;

    public static WhileNode find(Node root) {
        MainLoopFinder finder = new MainLoopFinder();
        root.accept(finder);
        return finder.result;
    }

    @Override
    protected void visitChild(Node node) {
        if (result == null) {
            super.visitChild(node);
        }
    }

    @Override
    public void visit(WhileNode node) {
        if (result == null) {
            result = node;
        }
    }
}
