package org.athos.astnode;

import java.util.ArrayList;
import java.util.List;

/**
 * An enumerated type {@code enum tag}. When the declaration also defines
 * the enumeration, {@link #enumerators} holds the constants in source
 * order (with an optional {@code = value} suffix); otherwise it is null.
 */
public class EnumType extends TypeDescriptor {
    public final String tag;
    public final List<String> enumerators;

    public EnumType(String tag, List<String> enumerators) {
        this.tag = tag;
        this.enumerators = enumerators;
    }

    @Override
    public TypeDescriptor copy() {
        return new EnumType(tag, enumerators == null ? null : new ArrayList<>(enumerators));
    }

    @Override
    public String toString() {
        return "enum " + tag;
    }
}
