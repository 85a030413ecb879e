package org.athos.astnode;

import org.athos.astvisitor.Visitor;

import java.util.ArrayList;
import java.util.List;

/**
 * The BlockNode class represents an ordered sequence of statements:
 * a compound statement {@code { ... }} or, when {@link #isFileScope} is set,
 * the list of external declarations of a translation unit.
 * <p>
 * The element list is mutable; the unfolding pass splices statements into it.
 */
public class BlockNode extends AbstractNode {
    /**
     * The list of child nodes contained in this BlockNode.
     */
    public final List<Node> elements;

    /**
     * This flag indicates if this BlockNode holds the top level of a file.
     */
    public boolean isFileScope;

    /**
     * Constructs a new BlockNode with the specified list of child nodes.
     *
     * @param elements the list of child nodes to be stored in this BlockNode
     * @param location the source location of the opening brace
     */
    public BlockNode(List<Node> elements, SourceLocation location) {
        super(location);
        this.elements = elements;
        this.isFileScope = false;
    }

    public BlockNode(SourceLocation location) {
        this(new ArrayList<>(), location);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
