package org.athos.astnode;

import java.util.ArrayList;
import java.util.List;

/**
 * A type written as a list of keywords, e.g. {@code int},
 * {@code unsigned long} or {@code const char}.
 */
public class NamedType extends TypeDescriptor {
    public final List<String> names;

    public NamedType(List<String> names) {
        this.names = names;
    }

    @Override
    public TypeDescriptor copy() {
        return new NamedType(new ArrayList<>(names));
    }

    @Override
    public String toString() {
        return String.join(" ", names);
    }
}
