package net.hollowcube.flags;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Set;

/**
 * The states of every flag which could be resolved for a distinct id. Flags which could not be resolved are absent.
 */
public final class FeatureFlagStates {
    public static final FeatureFlagStates EMPTY = new FeatureFlagStates(Map.of());

    private final Map<String, FeatureFlagState> states;

    FeatureFlagStates(@NotNull Map<String, FeatureFlagState> states) {
        this.states = Map.copyOf(states);
    }

    /**
     * @return the state of the flag, or null if it could not be resolved
     */
    public @Nullable FeatureFlagState get(@NotNull String key) {
        return states.get(key);
    }

    public boolean isEnabled(@NotNull String key) {
        final FeatureFlagState state = states.get(key);
        return state != null && state.isEnabled();
    }

    public @Nullable String getVariant(@NotNull String key) {
        final FeatureFlagState state = states.get(key);
        return state == null ? null : state.getVariant();
    }

    public @Nullable String getPayload(@NotNull String key) {
        final FeatureFlagState state = states.get(key);
        return state == null ? null : state.getPayload();
    }

    public @NotNull Set<String> keySet() {
        return states.keySet();
    }

    public @NotNull Map<String, FeatureFlagState> getStates() {
        return states;
    }

    @Override
    public String toString() {
        return states.toString();
    }
}
