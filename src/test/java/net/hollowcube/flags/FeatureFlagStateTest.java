package net.hollowcube.flags;

import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FeatureFlagStateTest {

    @Test
    void missingFlagIsDisabled() {
        var state = new FeatureFlagState(new JsonObject(), new JsonObject(), "test");
        assertFalse(state.isEnabled());
        assertNull(state.getVariant());
    }

    @Test
    void presentFalse() {
        var json = new JsonObject();
        json.addProperty("test", false);
        var state = new FeatureFlagState(json, new JsonObject(), "test");
        assertFalse(state.isEnabled());
        assertNull(state.getVariant());
    }

    @Test
    void presentTrue() {
        var json = new JsonObject();
        json.addProperty("test", true);
        var state = new FeatureFlagState(json, new JsonObject(), "test");
        assertTrue(state.isEnabled());
        assertNull(state.getVariant());
    }

    @Test
    void presentVariant() {
        var json = new JsonObject();
        json.addProperty("test", "variant");
        var state = new FeatureFlagState(json, new JsonObject(), "test");
        assertTrue(state.isEnabled());
        assertEquals("variant", state.getVariant());
    }

    @Test
    void numberIsDisabled() {
        var json = new JsonObject();
        json.addProperty("test", 1);
        var state = new FeatureFlagState(json, new JsonObject(), "test");
        assertFalse(state.isEnabled());
        assertNull(state.getVariant());
    }

    @Test
    void objectIsDisabled() {
        var json = new JsonObject();
        json.add("test", new JsonObject());
        var state = new FeatureFlagState(json, new JsonObject(), "test");
        assertFalse(state.isEnabled());
        assertNull(state.getVariant());
    }

    @Test
    void arrayIsDisabled() {
        var json = new JsonObject();
        json.add("test", new JsonArray());
        var state = new FeatureFlagState(json, new JsonObject(), "test");
        assertFalse(state.isEnabled());
        assertNull(state.getVariant());
    }

    @Test
    void nullIsDisabled() {
        var json = new JsonObject();
        json.add("test", JsonNull.INSTANCE);
        var state = new FeatureFlagState(json, new JsonObject(), "test");
        assertFalse(state.isEnabled());
        assertNull(state.getVariant());
    }

    @Test
    void emptyStringIsDisabled() {
        var json = new JsonObject();
        json.addProperty("test", "");
        var state = new FeatureFlagState(json, new JsonObject(), "test");
        assertFalse(state.isEnabled());
    }

    @Test
    void payloadOnlyWhenEnabled() {
        var flags = new JsonObject();
        flags.addProperty("on", true);
        flags.addProperty("off", false);
        var payloads = new JsonObject();
        payloads.addProperty("on", "{\"a\":1}");
        payloads.addProperty("off", "ignored");

        assertEquals("{\"a\":1}", new FeatureFlagState(flags, payloads, "on").getPayload());
        assertNull(new FeatureFlagState(flags, payloads, "off").getPayload());
    }

    @Test
    void nonStringPayloadKeptAsJson() {
        var flags = new JsonObject();
        flags.addProperty("on", "variant");
        var payload = new JsonObject();
        payload.addProperty("a", 1);
        var payloads = new JsonObject();
        payloads.add("on", payload);

        assertEquals("{\"a\":1}", new FeatureFlagState(flags, payloads, "on").getPayload());
    }

    @Test
    void jsonForm() {
        var state = new FeatureFlagState(FlagValue.variant("control"), "{\"a\":1}");
        assertEquals(state, FeatureFlagState.fromJson(state.toJson()));
        assertEquals(FeatureFlagState.DISABLED, FeatureFlagState.fromJson(FeatureFlagState.DISABLED.toJson()));
        assertNull(FeatureFlagState.fromJson(new JsonArray()));
        assertNull(FeatureFlagState.fromJson(new JsonObject()));
    }

}
