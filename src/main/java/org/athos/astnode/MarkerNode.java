package org.athos.astnode;

import org.athos.astvisitor.Visitor;

/**
 * A content-free statement that only exists in control-flow graphs, giving
 * a branching construct a single entry or merge point. Markers are never
 * part of a parsed program and never appear in reconstructed code.
 */
public class MarkerNode extends AbstractNode {

    public enum Kind {
        CONDITIONAL_ENTRY,
        CONDITIONAL_EXIT,
        LOOP_EXIT,
        FUNCTION_EXIT
    }

    public final Kind kind;

    public MarkerNode(Kind kind, SourceLocation location) {
        super(location);
        this.kind = kind;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
