package org.athos.astnode;

/**
 * A pointer to {@link #target}.
 */
public class PointerType extends TypeDescriptor {
    public final TypeDescriptor target;

    public PointerType(TypeDescriptor target) {
        this.target = target;
    }

    @Override
    public TypeDescriptor copy() {
        return new PointerType(target.copy());
    }

    @Override
    public String toString() {
        return target + " *";
    }
}
