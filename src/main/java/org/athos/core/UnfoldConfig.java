package org.athos.core;

import org.athos.unfold.SyncVariables;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The YAML configuration of a program: the names of its synchronization
 * variables plus any other entries the file carries.
 * <pre>
 *   round: vround
 *   mbox: mbox
 *   phase: view
 * </pre>
 * Keys other than {@code round} and {@code mbox} are kept untouched in
 * {@link #getExtras()}.
 */
public final class UnfoldConfig {
    private final SyncVariables syncVariables;
    private final Map<String, Object> extras;

    private UnfoldConfig(SyncVariables syncVariables, Map<String, Object> extras) {
        this.syncVariables = syncVariables;
        this.extras = extras;
    }

    public SyncVariables getSyncVariables() {
        return syncVariables;
    }

    public Map<String, Object> getExtras() {
        return extras;
    }

    /**
     * Loads a configuration file.
     *
     * @throws ConfigurationException if the file cannot be read or is invalid
     */
    public static UnfoldConfig load(Path path) {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read configuration file " + path, e);
        }
        return parse(text, path.toString());
    }

    /**
     * Parses configuration text.
     *
     * @param text  YAML document
     * @param label name used in error messages
     * @throws ConfigurationException if the document is invalid
     */
    public static UnfoldConfig parse(String text, String label) {
        LoadSettings loadSettings = LoadSettings.builder()
                .setLabel(label)
                .setAllowDuplicateKeys(false)
                .build();
        Load load = new Load(loadSettings);

        Object document;
        try {
            document = load.loadFromString(text);
        } catch (YamlEngineException e) {
            throw new ConfigurationException("Invalid YAML in " + label + ": " + e.getMessage(), e);
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new ConfigurationException("Configuration " + label + " must be a mapping");
        }

        Map<String, Object> extras = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            extras.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        String round = requireName(extras, SyncVariables.Role.ROUND.key, label);
        String mbox = requireName(extras, SyncVariables.Role.MBOX.key, label);
        extras.remove(SyncVariables.Role.ROUND.key);
        extras.remove(SyncVariables.Role.MBOX.key);

        return new UnfoldConfig(new SyncVariables(round, mbox), extras);
    }

    private static String requireName(Map<String, Object> entries, String key, String label) {
        Object value = entries.get(key);
        if (value == null) {
            throw new ConfigurationException("Configuration " + label + " has no '" + key + "' entry");
        }
        if (!(value instanceof String name) || name.isBlank()) {
            throw new ConfigurationException("Configuration " + label + ": '" + key
                    + "' must be a variable name, got " + value);
        }
        return name;
    }
}
