package org.athos.astnode;

/**
 * Base class of the type part of a {@link DeclarationNode}.
 * <p>
 * Type descriptors are not statements and are not visited; they are copied
 * together with the declaration that owns them.
 */
public abstract class TypeDescriptor {

    /**
     * Returns a deep copy of this type descriptor.
     *
     * @return a new, independent descriptor
     */
    public abstract TypeDescriptor copy();
}
