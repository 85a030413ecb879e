package org.athos.astvisitor;

import org.athos.astnode.IdentifierNode;
import org.athos.astnode.Node;

import java.util.Map;

/**
 * Renames identifier references in place.
 * <p>
 * Only {@link IdentifierNode}s are touched: declared names, struct member
 * names and enumeration constants in type definitions keep their text.
 * <pre>
 *   RenameVisitor.rename(statement, Map.of("round", "round_1"));
 * </pre>
 */
public class RenameVisitor extends DepthFirstVisitor {
    private final Map<String, String> renames;
    private int renamed;

    public RenameVisitor(Map<String, String> renames) {
        this.renames = renames;
    }

    /**
     * Applies {@code renames} to every identifier under {@code node}.
     *
     * @return the number of identifiers renamed
     */
    public static int rename(Node node, Map<String, String> renames) {
        if (node == null || renames.isEmpty()) {
            return 0;
        }
        RenameVisitor visitor = new RenameVisitor(renames);
        node.accept(visitor);
        return visitor.renamed;
    }

    @Override
    public void visit(IdentifierNode node) {
        String newName = renames.get(node.name);
        if (newName != null) {
            node.name = newName;
            renamed++;
        }
    }
}
