package org.athos.unfold;

import org.athos.astnode.*;
import org.athos.astvisitor.CloneVisitor;
import org.athos.astvisitor.DepthFirstVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Declares one variable per unfolding generation.
 * <p>
 * For every declaration of one of the given names, {@code generations}
 * copies named {@code name_0 .. name_(generations-1)} are inserted, in that
 * order, immediately before the original in its enclosing block.
 * <p>
 * Only two shapes are recognized: a variable of enumerated type
 * ({@code enum phase round;}) and a pointer ({@code struct list *mbox;}).
 * Any other declaration of the name is left alone. When the original also
 * defines its enumeration, the definition moves to {@code name_0}.
 */
public final class IteratedDeclarations {

    private IteratedDeclarations() {
    }

    /**
     * Inserts the generation declarations.
     *
     * @param ast         the program root
     * @param names       variable names to declare per generation
     * @param generations number of generations, starting at 0
     * @return the number of declarations inserted
     */
    public static int declare(Node ast, Set<String> names, int generations) {
        DeclarationCollector collector = new DeclarationCollector(names);
        ast.accept(collector);

        // Positions are looked up only after the walk is over
        int inserted = 0;
        for (int i = 0; i < collector.declarations.size(); i++) {
            BlockNode parent = collector.parents.get(i);
            DeclarationNode declaration = collector.declarations.get(i);

            List<Node> copies = new ArrayList<>(generations);
            for (int generation = 0; generation < generations; generation++) {
                copies.add(generationCopy(declaration, generation));
            }
            moveEnumDefinition(declaration, copies);
            parent.elements.addAll(indexOf(parent, declaration), copies);
            inserted += copies.size();
        }
        return inserted;
    }

    public static boolean isRecognized(DeclarationNode declaration) {
        return declaration.type instanceof EnumType || declaration.type instanceof PointerType;
    }

    private static DeclarationNode generationCopy(DeclarationNode declaration, int generation) {
        DeclarationNode copy = (DeclarationNode) CloneVisitor.clone(declaration);
        copy.name = SyncVariables.generationName(declaration.name, generation);
        if (copy.type instanceof EnumType enumType && enumType.enumerators != null) {
            copy.type = new EnumType(enumType.tag, null);
        }
        return copy;
    }

    /**
     * An enumeration defined by the original declaration is defined by the
     * first copy instead, which now comes first in the block.
     */
    private static void moveEnumDefinition(DeclarationNode declaration, List<Node> copies) {
        if (copies.isEmpty() || !(declaration.type instanceof EnumType enumType) || enumType.enumerators == null) {
            return;
        }
        ((DeclarationNode) copies.get(0)).type = enumType;
        declaration.type = new EnumType(enumType.tag, null);
    }

    private static int indexOf(BlockNode parent, Node element) {
        for (int i = 0; i < parent.elements.size(); i++) {
            if (parent.elements.get(i) == element) {
                return i;
            }
        }
        throw new IllegalStateException("Declaration moved during unfolding: " + element.getLocation());
    }

    private static final class DeclarationCollector extends DepthFirstVisitor {
        private final Set<String> names;
        private final List<BlockNode> parents = new ArrayList<>();
        private final List<DeclarationNode> declarations = new ArrayList<>();

        private DeclarationCollector(Set<String> names) {
            this.names = names;
        }

        @Override
        public void visit(BlockNode node) {
            for (Node element : node.elements) {
                if (element instanceof DeclarationNode declaration
                        && declaration.name != null
                        && names.contains(declaration.name)
                        && isRecognized(declaration)) {
                    parents.add(node);
                    declarations.add(declaration);
                }
            }
            super.visit(node);
        }
    }
}
