package org.athos.unfold;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.athos.unfold.SyncVariables.Role.MBOX;
import static org.athos.unfold.SyncVariables.Role.ROUND;
import static org.junit.jupiter.api.Assertions.*;

public class SyncVariablesTest {

    @Test
    public void testGenerationNames() {
        SyncVariables sync = new SyncVariables("vround", "mbox");
        assertEquals("vround", sync.name(ROUND));
        assertEquals("vround_2", sync.generation(ROUND, 2));
        assertEquals("mbox_0", sync.generation(MBOX, 0));
    }

    @Test
    public void testRenames() {
        SyncVariables sync = new SyncVariables("vround", "mbox");
        assertEquals(Map.of("vround", "vround_1", "mbox", "mbox_1"), sync.renames(1, ROUND, MBOX));
        assertEquals(Map.of("mbox", "mbox_0"), sync.renames(0, MBOX));
    }

    @Test
    public void testNamesAreRequired() {
        assertThrows(NullPointerException.class, () -> new SyncVariables(null, "mbox"));
    }
}
