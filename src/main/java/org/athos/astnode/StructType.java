package org.athos.astnode;

import org.athos.astvisitor.CloneVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * A structure type {@code struct tag}, with its field declarations when
 * the declaration defines the structure (null otherwise).
 */
public class StructType extends TypeDescriptor {
    public final String tag;
    public final List<DeclarationNode> fields;

    public StructType(String tag, List<DeclarationNode> fields) {
        this.tag = tag;
        this.fields = fields;
    }

    @Override
    public TypeDescriptor copy() {
        if (fields == null) {
            return new StructType(tag, null);
        }
        List<DeclarationNode> copies = new ArrayList<>(fields.size());
        for (DeclarationNode field : fields) {
            copies.add((DeclarationNode) CloneVisitor.clone(field));
        }
        return new StructType(tag, copies);
    }

    @Override
    public String toString() {
        return "struct " + tag;
    }
}
