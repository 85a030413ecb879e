package org.athos.astnode;

import org.athos.astvisitor.Visitor;

/**
 * Represents a {@code continue;} statement.
 */
public class ContinueNode extends AbstractNode {

    public ContinueNode(SourceLocation location) {
        super(location);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
