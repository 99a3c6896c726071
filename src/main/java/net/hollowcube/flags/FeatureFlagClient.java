package net.hollowcube.flags;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.Objects;

import static net.hollowcube.flags.PostHogNames.nonNullNonEmpty;

/**
 * Evaluates PostHog feature flags, locally where the loaded definitions allow it and remotely otherwise.
 *
 * <p>Multiple clients may be created and managed independently.</p>
 *
 * <p>Methods may block on a remote evaluation unless local evaluation or the result cache can answer. Flag
 * evaluation never throws for an unresolvable flag, it returns null instead.</p>
 */
public sealed interface FeatureFlagClient permits FeatureFlagClientImpl {

    static @NotNull Builder newBuilder() {
        return new Builder();
    }

    /**
     * Stops polling for flag definitions and shuts down the definition cache provider. May be called more than once.
     */
    void shutdown();


    // Feature flags

    /**
     * Check if the given feature flag is enabled for the given distinct ID.
     *
     * @param key        Feature flag key
     * @param distinctId Unique ID of the target in your database. May not be empty
     * @return True if the feature flag is enabled for the given distinct ID, false if it is disabled or could not be resolved
     */
    default boolean isFeatureEnabled(@NotNull String key, @NotNull String distinctId) {
        return isFeatureEnabled(key, distinctId, null);
    }

    /**
     * Check if the given feature flag is enabled for the given distinct ID with extra context.
     *
     * @param key        Feature flag key
     * @param distinctId Unique ID of the target in your database. May not be empty
     * @param context    Extra context to pass to the feature flag evaluation
     * @return True if the feature flag is enabled for the given distinct ID, false if it is disabled or could not be resolved
     */
    default boolean isFeatureEnabled(@NotNull String key, @NotNull String distinctId, @Nullable FeatureFlagContext context) {
        final FeatureFlagState state = getFeatureFlag(key, distinctId, context);
        return state != null && state.isEnabled();
    }

    /**
     * Get the feature flag state for the given distinct ID.
     *
     * @param key        Feature flag key
     * @param distinctId Unique ID of the target in your database. May not be empty
     * @return Feature flag state, or null if it could not be resolved locally, remotely or from the cache
     */
    default @Nullable FeatureFlagState getFeatureFlag(@NotNull String key, @NotNull String distinctId) {
        return getFeatureFlag(key, distinctId, null);
    }

    /**
     * Get the feature flag state for the given distinct ID with extra context.
     *
     * @param key        Feature flag key
     * @param distinctId Unique ID of the target in your database. May not be empty
     * @param context    Extra context to pass to the feature flag evaluation
     * @return Feature flag state, or null if it could not be resolved locally, remotely or from the cache
     */
    @Nullable FeatureFlagState getFeatureFlag(@NotNull String key, @NotNull String distinctId, @Nullable FeatureFlagContext context);

    /**
     * Get the feature flag payload for the given distinct ID.
     *
     * @return Feature flag payload, or null if the feature flag is disabled, unresolved <i>or</i> has no payload configured.
     */
    default @Nullable String getFeatureFlagPayload(@NotNull String key, @NotNull String distinctId) {
        return getFeatureFlagPayload(key, distinctId, null);
    }

    /**
     * Get the feature flag payload for the given distinct ID with extra context.
     *
     * @return Feature flag payload, or null if the feature flag is disabled, unresolved <i>or</i> has no payload configured.
     */
    default @Nullable String getFeatureFlagPayload(@NotNull String key, @NotNull String distinctId, @Nullable FeatureFlagContext context) {
        final FeatureFlagState state = getFeatureFlag(key, distinctId, context);
        return state == null ? null : state.getPayload();
    }

    /**
     * Get all feature flags for the given distinct ID.
     *
     * @param distinctId Unique ID of the target in your database. May not be empty
     * @return Feature flag states
     */
    default @NotNull FeatureFlagStates getAllFeatureFlags(@NotNull String distinctId) {
        return getAllFeatureFlags(distinctId, null);
    }

    /**
     * Get all feature flags for the given distinct ID with extra context.
     *
     * <p>Flags which could not be resolved are absent from the result.</p>
     *
     * @param distinctId Unique ID of the target in your database. May not be empty
     * @param context    Extra context to pass to the feature flag evaluation
     * @return Feature flag states
     */
    @NotNull FeatureFlagStates getAllFeatureFlags(@NotNull String distinctId, @Nullable FeatureFlagContext context);

    /**
     * Reloads the flag definitions, consulting the definition cache provider if one is configured.
     *
     * @throws IllegalStateException if local feature flag evaluation is not enabled.
     */
    @Blocking
    void reloadFeatureFlags();

    /**
     * Applies a realtime change to a single flag definition without a full reload.
     *
     * <p>A patch with {@code "deleted": true} removes the flag with the patch's key, any other patch inserts or
     * replaces it. Results cached for the previous definitions are invalidated.</p>
     *
     * @throws IllegalStateException    if local feature flag evaluation is not enabled.
     * @throws IllegalArgumentException if the patch has no key or is not a valid flag definition.
     */
    void applyFlagUpdate(@NotNull JsonObject patch);


    // Client builder

    final class Builder {
        private FlagDefinitionSource definitionSource = null;
        private RemoteEvaluator remoteEvaluator = null;
        private AnalyticsSink analyticsSink = null;
        private FlagDefinitionCacheProvider flagDefinitionCacheProvider = null;
        private FlagResultCache flagResultCache = null; // Set on build if not overridden
        private FlagUpdateListener onFeatureFlagsUpdate = null;

        private String endpoint = null;
        private String projectApiKey = null;
        private String personalApiKey = null;

        private boolean allowRemoteFeatureFlagEvaluation = true;
        private boolean sendFeatureFlagEvents = true;
        private Duration featureFlagsPollingInterval = Duration.ofMinutes(5);
        private Duration featureFlagsRequestTimeout = Duration.ofSeconds(3);

        private Gson gson = null; // Set on build if not overridden

        private Builder() {
        }

        /**
         * Sets the source of flag definitions. Local evaluation is only possible with a definition source.
         */
        @Contract(pure = true)
        public @NotNull Builder definitionSource(@NotNull FlagDefinitionSource definitionSource) {
            this.definitionSource = Objects.requireNonNull(definitionSource);
            return this;
        }

        @Contract(pure = true)
        public @NotNull Builder remoteEvaluator(@NotNull RemoteEvaluator remoteEvaluator) {
            this.remoteEvaluator = Objects.requireNonNull(remoteEvaluator);
            return this;
        }

        @Contract(pure = true)
        public @NotNull Builder analyticsSink(@NotNull AnalyticsSink analyticsSink) {
            this.analyticsSink = Objects.requireNonNull(analyticsSink);
            return this;
        }

        @Contract(pure = true)
        public @NotNull Builder flagDefinitionCacheProvider(@NotNull FlagDefinitionCacheProvider flagDefinitionCacheProvider) {
            this.flagDefinitionCacheProvider = Objects.requireNonNull(flagDefinitionCacheProvider);
            return this;
        }

        @Contract(pure = true)
        public @NotNull Builder flagResultCache(@NotNull FlagResultCache flagResultCache) {
            this.flagResultCache = Objects.requireNonNull(flagResultCache);
            return this;
        }

        @Contract(pure = true)
        public @NotNull Builder onFeatureFlagsUpdate(@NotNull FlagUpdateListener onFeatureFlagsUpdate) {
            this.onFeatureFlagsUpdate = Objects.requireNonNull(onFeatureFlagsUpdate);
            return this;
        }

        /**
         * Talk to PostHog over HTTP. Explicitly configured sources or evaluators take precedence.
         *
         * @param personalApiKey enables local evaluation, may be null to only evaluate remotely
         */
        @Contract(pure = true)
        public @NotNull Builder httpTransport(@NotNull String endpoint, @NotNull String projectApiKey, @Nullable String personalApiKey) {
            this.endpoint = nonNullNonEmpty("endpoint", endpoint);
            this.projectApiKey = nonNullNonEmpty("projectApiKey", projectApiKey);
            this.personalApiKey = personalApiKey;
            return this;
        }

        @Contract(pure = true)
        public @NotNull Builder allowRemoteFeatureFlagEvaluation(boolean allowRemoteFeatureFlagEvaluation) {
            this.allowRemoteFeatureFlagEvaluation = allowRemoteFeatureFlagEvaluation;
            return this;
        }

        @Contract(pure = true)
        public @NotNull Builder sendFeatureFlagEvents(boolean sendFeatureFlagEvents) {
            this.sendFeatureFlagEvents = sendFeatureFlagEvents;
            return this;
        }

        /**
         * @param featureFlagsPollingInterval interval between definition reloads, {@link Duration#ZERO} disables
         *                                    polling entirely (see {@link #reloadFeatureFlags()})
         */
        @Contract(pure = true)
        public @NotNull Builder featureFlagsPollingInterval(@NotNull Duration featureFlagsPollingInterval) {
            if (featureFlagsPollingInterval.isNegative())
                throw new IllegalArgumentException("Feature flags polling interval must not be negative");
            this.featureFlagsPollingInterval = Objects.requireNonNull(featureFlagsPollingInterval);
            return this;
        }

        @Contract(pure = true)
        public @NotNull Builder featureFlagsRequestTimeout(@NotNull Duration featureFlagsRequestTimeout) {
            if (featureFlagsRequestTimeout.isNegative() || featureFlagsRequestTimeout.isZero())
                throw new IllegalArgumentException("Feature flags request timeout must be positive");
            this.featureFlagsRequestTimeout = Objects.requireNonNull(featureFlagsRequestTimeout);
            return this;
        }

        /**
         * Allows overriding the {@link Gson} instance used for de/serializing flag definitions and properties.
         * Can be useful for handling custom property types.
         *
         * <p>The default instance will {@link GsonBuilder#disableJdkUnsafe()} and {@link GsonBuilder#setFieldNamingPolicy(FieldNamingPolicy)} {@link FieldNamingPolicy#LOWER_CASE_WITH_UNDERSCORES}</p>
         *
         * @param gson A constructed {@link Gson} instance to use for de/serialization.
         */
        @Contract(pure = true)
        public @NotNull Builder gson(@NotNull Gson gson) {
            this.gson = Objects.requireNonNull(gson);
            return this;
        }

        /**
         * @throws IllegalArgumentException if remote evaluation is disabled and there is no definition source
         */
        public @NotNull FeatureFlagClient build() {
            var gson = Objects.requireNonNullElseGet(this.gson, () -> new GsonBuilder()
                    .disableJdkUnsafe()
                    .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                    .create());

            var definitionSource = this.definitionSource;
            var remoteEvaluator = this.remoteEvaluator;
            if (endpoint != null) {
                var transport = new HttpFlagTransport(gson, endpoint, projectApiKey, personalApiKey, featureFlagsRequestTimeout);
                if (definitionSource == null && transport.supportsLocalEvaluation()) definitionSource = transport;
                if (remoteEvaluator == null) remoteEvaluator = transport;
            }

            var flagResultCache = Objects.requireNonNullElseGet(this.flagResultCache, LocalFlagResultCache::new);
            return new FeatureFlagClientImpl(
                    gson,
                    definitionSource, remoteEvaluator, analyticsSink, // Collaborators
                    flagDefinitionCacheProvider, flagResultCache, onFeatureFlagsUpdate,
                    allowRemoteFeatureFlagEvaluation, sendFeatureFlagEvents, // Behavior
                    featureFlagsPollingInterval
            );
        }
    }

}
