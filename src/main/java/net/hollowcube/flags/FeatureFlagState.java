package net.hollowcube.flags;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The resolved state of a single feature flag: its value and the payload configured for that value.
 */
public final class FeatureFlagState {
    public static final FeatureFlagState ENABLED = new FeatureFlagState(FlagValue.TRUE, null);
    public static final FeatureFlagState DISABLED = new FeatureFlagState(FlagValue.FALSE, null);

    private final FlagValue value;
    private final String payload;

    FeatureFlagState(@NotNull FlagValue value, @Nullable String payload) {
        this.value = Objects.requireNonNull(value, "value");
        this.payload = payload;
    }

    /**
     * Reads the state of a flag from a remote evaluation response. Anything other than a boolean or variant
     * string (including a missing flag) is disabled.
     */
    FeatureFlagState(@Nullable JsonObject featureFlags, @Nullable JsonObject featureFlagPayloads, @NotNull String key) {
        final FlagValue parsed = featureFlags == null ? null : FlagValue.fromJson(featureFlags.get(key));
        this.value = parsed == null ? FlagValue.FALSE : parsed;
        this.payload = this.value.isEnabled() && featureFlagPayloads != null
                ? payloadString(featureFlagPayloads.get(key)) : null;
    }

    /**
     * Returns true if the feature flag is enabled, false otherwise. A variant response is true.
     */
    public boolean isEnabled() {
        return value.isEnabled();
    }

    /**
     * Returns the variant of the feature flag if it is enabled and a variant, null otherwise.
     *
     * <p>Note that a feature flag which is enabled but not a variant will return null.</p>
     */
    public @Nullable String getVariant() {
        return value.variant();
    }

    /**
     * Returns the payload of the feature flag if it is enabled and has a payload, null otherwise.
     *
     * <p>Note that a feature flag which is enabled but has no payload will return null</p>
     */
    public @Nullable String getPayload() {
        return payload;
    }

    public @NotNull FlagValue getValue() {
        return value;
    }

    @NotNull JsonObject toJson() {
        final JsonObject json = new JsonObject();
        json.add("value", value.toJson());
        if (payload != null) json.addProperty("payload", payload);
        return json;
    }

    static @Nullable FeatureFlagState fromJson(@Nullable JsonElement element) {
        if (!(element instanceof JsonObject json)) return null;
        final FlagValue value = FlagValue.fromJson(json.get("value"));
        if (value == null) return null;
        return new FeatureFlagState(value, payloadString(json.get("payload")));
    }

    static @Nullable String payloadString(@Nullable JsonElement payload) {
        if (payload == null || payload.isJsonNull()) return null;
        return payload instanceof JsonPrimitive primitive && primitive.isString() ? primitive.getAsString() : payload.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureFlagState other)) return false;
        return value.equals(other.value) && Objects.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, payload);
    }

    @Override
    public String toString() {
        return payload == null ? value.toString() : value + " (" + payload + ")";
    }
}
