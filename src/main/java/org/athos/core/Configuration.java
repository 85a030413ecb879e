package org.athos.core;

/**
 * Central configuration class for the unfolding tool.
 * Contains constants that control the transform and the command line.
 */
public final class Configuration {

    public static final String toolName = "athos";
    public static final String version = "1.0.0";

    /**
     * Separator between a synchronization variable and its generation
     * number, as in {@code round_2}.
     */
    public static final String GENERATION_SEPARATOR = "_";

    // Prevent instantiation
    private Configuration() {
    }

    public static String getVersionString() {
        return toolName + " " + version;
    }
}
