package org.athos.core;

import org.athos.unfold.SyncVariables;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class UnfoldConfigTest {

    @Test
    public void testParse() {
        UnfoldConfig config = UnfoldConfig.parse("round: vround\nmbox: mbox\nphase: view\nlabels: [A, B]\n", "test.yaml");

        SyncVariables sync = config.getSyncVariables();
        assertEquals("vround", sync.name(SyncVariables.Role.ROUND));
        assertEquals("mbox", sync.name(SyncVariables.Role.MBOX));
        assertEquals("view", config.getExtras().get("phase"));
        assertEquals(List.of("A", "B"), config.getExtras().get("labels"));
        assertFalse(config.getExtras().containsKey("round"));
    }

    @Test
    public void testLoad(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("config.yaml");
        Files.writeString(file, "# comment\nround: r\nmbox: box\n");

        UnfoldConfig config = UnfoldConfig.load(file);

        assertEquals("box", config.getSyncVariables().name(SyncVariables.Role.MBOX));
        assertTrue(config.getExtras().isEmpty());
    }

    @Test
    public void testMissingFile(@TempDir Path dir) {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> UnfoldConfig.load(dir.resolve("missing.yaml")));
        assertTrue(e.getMessage().contains("missing.yaml"));
    }

    @Test
    public void testMissingRole() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> UnfoldConfig.parse("round: r\n", "test.yaml"));
        assertTrue(e.getMessage().contains("'mbox'"));
    }

    @Test
    public void testRoleMustBeName() {
        assertThrows(ConfigurationException.class, () -> UnfoldConfig.parse("round: 3\nmbox: m\n", "test.yaml"));
        assertThrows(ConfigurationException.class, () -> UnfoldConfig.parse("round: ' '\nmbox: m\n", "test.yaml"));
    }

    @Test
    public void testInvalidYaml() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> UnfoldConfig.parse("round: [r\nmbox: m\n", "broken.yaml"));
        assertTrue(e.getMessage().startsWith("Invalid YAML in broken.yaml"));
    }

    @Test
    public void testDuplicateKeys() {
        assertThrows(ConfigurationException.class, () -> UnfoldConfig.parse("round: a\nround: b\nmbox: m\n", "dup.yaml"));
    }

    @Test
    public void testDocumentMustBeMapping() {
        assertThrows(ConfigurationException.class, () -> UnfoldConfig.parse("- round\n- mbox\n", "list.yaml"));
        assertThrows(ConfigurationException.class, () -> UnfoldConfig.parse("", "empty.yaml"));
    }

    @Test
    public void testVersionString() {
        assertTrue(Configuration.getVersionString().contains(Configuration.version));
    }
}
