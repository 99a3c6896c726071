package net.hollowcube.flags;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Extra information about the subject of a flag evaluation.
 *
 * <p>Group flags are evaluated against the group key given for their group type, and against that group's
 * properties. A group flag whose group is absent here evaluates to false.</p>
 *
 * @param groups                group type name to group key, e.g. {@code company -> "acme"}
 * @param personProperties      any object serializable to a JSON object with Gson
 * @param groupProperties       group type name to an object serializable to a JSON object
 * @param sendFeatureFlagEvents overrides the client setting when non-null
 * @param allowRemoteEvaluation overrides the client setting when non-null. False only evaluates locally
 *                              (or from fresh cached results)
 */
public record FeatureFlagContext(
        @Nullable Map<String, String> groups,
        @Nullable Object personProperties,
        @Nullable Map<String, Object> groupProperties,
        @Nullable Boolean sendFeatureFlagEvents,
        @Nullable Boolean allowRemoteEvaluation
) {
    public static final FeatureFlagContext EMPTY = new FeatureFlagContext(null, null, null, null, null);

    public FeatureFlagContext {
        groups = groups == null ? null : Map.copyOf(groups);
        groupProperties = groupProperties == null ? null : Map.copyOf(groupProperties);
    }

    public static @NotNull Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> groups = new LinkedHashMap<>();
        private final Map<String, Object> groupProperties = new LinkedHashMap<>();
        private Object personProperties;
        private Boolean sendFeatureFlagEvents;
        private Boolean allowRemoteEvaluation;

        private Builder() {
        }

        /**
         * Replaces all groups set so far.
         */
        @Contract("_ -> this")
        public @NotNull Builder groups(@Nullable Map<String, String> groups) {
            this.groups.clear();
            if (groups != null) this.groups.putAll(groups);
            return this;
        }

        @Contract("_, _ -> this")
        public @NotNull Builder group(@NotNull String groupType, @NotNull String groupKey) {
            this.groups.put(PostHogNames.nonNullNonEmpty("groupType", groupType),
                    PostHogNames.nonNullNonEmpty("groupKey", groupKey));
            return this;
        }

        @Contract("_ -> this")
        public @NotNull Builder personProperties(@Nullable Object personProperties) {
            this.personProperties = personProperties;
            return this;
        }

        /**
         * Replaces all group properties set so far.
         */
        @Contract("_ -> this")
        public @NotNull Builder groupProperties(@Nullable Map<String, Object> groupProperties) {
            this.groupProperties.clear();
            if (groupProperties != null) this.groupProperties.putAll(groupProperties);
            return this;
        }

        @Contract("_, _ -> this")
        public @NotNull Builder groupProperties(@NotNull String groupType, @NotNull Object properties) {
            this.groupProperties.put(PostHogNames.nonNullNonEmpty("groupType", groupType), Objects.requireNonNull(properties));
            return this;
        }

        @Contract("_ -> this")
        public @NotNull Builder sendFeatureFlagEvents(@Nullable Boolean sendFeatureFlagEvents) {
            this.sendFeatureFlagEvents = sendFeatureFlagEvents;
            return this;
        }

        @Contract("_ -> this")
        public @NotNull Builder allowRemoteEvaluation(@Nullable Boolean allowRemoteEvaluation) {
            this.allowRemoteEvaluation = allowRemoteEvaluation;
            return this;
        }

        @Contract("-> new")
        public @NotNull FeatureFlagContext build() {
            return new FeatureFlagContext(
                    groups.isEmpty() ? null : groups,
                    personProperties,
                    groupProperties.isEmpty() ? null : groupProperties,
                    sendFeatureFlagEvents, allowRemoteEvaluation
            );
        }
    }

}
