package org.athos.unfold;

import org.athos.core.Configuration;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps the synchronization roles to the concrete variable names used by a
 * program. Generation {@code i} of a variable {@code name} is
 * {@code name_i}.
 */
public final class SyncVariables {

    /**
     * The logical roles; {@link #key} is the configuration key.
     */
    public enum Role {
        ROUND("round"),
        MBOX("mbox");

        public final String key;

        Role(String key) {
            this.key = key;
        }
    }

    private final Map<Role, String> names = new EnumMap<>(Role.class);

    public SyncVariables(String round, String mbox) {
        names.put(Role.ROUND, Objects.requireNonNull(round, "round"));
        names.put(Role.MBOX, Objects.requireNonNull(mbox, "mbox"));
    }

    public String name(Role role) {
        return names.get(role);
    }

    /**
     * Returns the name of generation {@code generation} of the role's variable.
     */
    public String generation(Role role, int generation) {
        return generationName(names.get(role), generation);
    }

    public static String generationName(String name, int generation) {
        return name + Configuration.GENERATION_SEPARATOR + generation;
    }

    /**
     * Builds a rename map sending each given role to the given generation.
     */
    public Map<String, String> renames(int generation, Role... roles) {
        Map<String, String> renames = new HashMap<>();
        for (Role role : roles) {
            renames.put(name(role), generation(role, generation));
        }
        return renames;
    }

    @Override
    public String toString() {
        return "SyncVariables{round=" + name(Role.ROUND) + ", mbox=" + name(Role.MBOX) + '}';
    }
}
