package org.abstractica.frontend;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ExportedSession} and {@link CloseReason}.
 */
class ExportedSessionTest
{
    @Test
    void settings_areCopiedAndUnmodifiable()
    {
        Map<String, SettingValue> settings = new HashMap<>();
        settings.put("score", SettingValue.of(10));

        ExportedSession exported = new ExportedSession(1, "f1", "7", settings);
        settings.put("score", SettingValue.of(11));

        assertEquals(SettingValue.of(10), exported.settings().get("score"));
        assertThrows(UnsupportedOperationException.class, () -> exported.settings().clear());
    }

    @Test
    void equality_isByValue()
    {
        ExportedSession a = new ExportedSession(1, "f1", null, Map.of());
        ExportedSession b = new ExportedSession(1, "f1", null, new HashMap<>());

        assertEquals(a, b);
        assertNull(a.uid());
    }

    @Test
    void kicked_withoutMessage_usesDefault()
    {
        assertEquals(new CloseReason.Kicked("kick"), CloseReason.kicked(null));
        assertEquals(new CloseReason.Kicked("admin"), CloseReason.kicked("admin"));
    }
}
