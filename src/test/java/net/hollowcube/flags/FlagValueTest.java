package net.hollowcube.flags;

import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FlagValueTest {

    @Test
    void fromJson() {
        assertEquals(FlagValue.TRUE, FlagValue.fromJson(new JsonPrimitive(true)));
        assertEquals(FlagValue.FALSE, FlagValue.fromJson(new JsonPrimitive(false)));
        assertEquals(FlagValue.variant("control"), FlagValue.fromJson(new JsonPrimitive("control")));
        assertNull(FlagValue.fromJson(new JsonPrimitive("")));
        assertNull(FlagValue.fromJson(new JsonPrimitive(1)));
        assertNull(FlagValue.fromJson(JsonNull.INSTANCE));
        assertNull(FlagValue.fromJson(new JsonArray()));
        assertNull(FlagValue.fromJson(null));
    }

    @Test
    void enabled() {
        assertTrue(FlagValue.TRUE.isEnabled());
        assertFalse(FlagValue.FALSE.isEnabled());
        assertTrue(FlagValue.variant("control").isEnabled());
        assertNull(FlagValue.TRUE.variant());
        assertEquals("control", FlagValue.variant("control").variant());
    }

    @Test
    void satisfies() {
        var control = FlagValue.variant("control");

        assertTrue(control.satisfies(FlagValue.TRUE));
        assertFalse(control.satisfies(FlagValue.FALSE));
        assertTrue(control.satisfies(FlagValue.variant("control")));
        assertFalse(control.satisfies(FlagValue.variant("Control")));

        assertTrue(FlagValue.FALSE.satisfies(FlagValue.FALSE));
        assertFalse(FlagValue.TRUE.satisfies(FlagValue.FALSE));
        assertFalse(FlagValue.TRUE.satisfies(FlagValue.variant("control")));
    }
}
