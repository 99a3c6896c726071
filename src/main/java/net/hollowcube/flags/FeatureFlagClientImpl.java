package net.hollowcube.flags;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import net.hollowcube.flags.FlagDefinitions.Flag;
import net.hollowcube.flags.RemoteEvaluator.RemoteEvaluation;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static net.hollowcube.flags.PostHogNames.*;

final class FeatureFlagClientImpl implements FeatureFlagClient {
    private static final Logger log = LoggerFactory.getLogger(FeatureFlagClientImpl.class);

    private static final int RECENTLY_CAPTURED_LIMIT = 50_000;

    private final Gson gson;
    private final RemoteEvaluator remoteEvaluator;
    private final AnalyticsSink analyticsSink;
    private final FlagResultCache resultCache;

    private final FlagDefinitionStore store; // Null if local evaluation is disabled
    private final Timer featureFlagFetchTimer; // Null if polling is disabled

    private final Map<String, Boolean> recentlyCapturedFeatureFlags = new ConcurrentHashMap<>();
    private final boolean allowRemoteFeatureFlagEvaluation;
    private final boolean sendFeatureFlagEvents;

    FeatureFlagClientImpl(
            @NotNull Gson gson,
            // Collaborators
            @Nullable FlagDefinitionSource definitionSource,
            @Nullable RemoteEvaluator remoteEvaluator,
            @Nullable AnalyticsSink analyticsSink,
            @Nullable FlagDefinitionCacheProvider cacheProvider,
            @NotNull FlagResultCache resultCache,
            @Nullable FlagUpdateListener updateListener,
            // Behavior
            boolean allowRemoteFeatureFlagEvaluation,
            boolean sendFeatureFlagEvents,
            @NotNull Duration featureFlagsPollingInterval
    ) {
        this.gson = gson;
        this.remoteEvaluator = remoteEvaluator;
        this.analyticsSink = analyticsSink;
        this.resultCache = resultCache;

        if (definitionSource != null) {
            this.store = new FlagDefinitionStore(gson, definitionSource, cacheProvider, resultCache, updateListener);
            this.featureFlagFetchTimer = featureFlagsPollingInterval.isZero() ? null
                    : new Timer("posthog-flag-poller", this::loadFeatureFlags, featureFlagsPollingInterval);
        } else if (!allowRemoteFeatureFlagEvaluation) {
            throw new IllegalArgumentException("A flag definition source is required when remote feature flag evaluation is disabled");
        } else {
            this.store = null;
            this.featureFlagFetchTimer = null;
        }
        this.allowRemoteFeatureFlagEvaluation = allowRemoteFeatureFlagEvaluation;
        this.sendFeatureFlagEvents = sendFeatureFlagEvents;
    }

    @Override
    public void shutdown() {
        if (this.featureFlagFetchTimer != null) this.featureFlagFetchTimer.close();
        if (this.store != null) this.store.shutdown();
    }

    // Feature flags

    @Override
    public @Nullable FeatureFlagState getFeatureFlag(@NotNull String key, @NotNull String distinctId, @Nullable FeatureFlagContext context) {
        final String featureFlagKey = nonNullNonEmpty("key", key);
        nonNullNonEmpty("distinctId", distinctId);
        final FeatureFlagContext featureFlagContext = Objects.requireNonNullElse(context, FeatureFlagContext.EMPTY);
        final EvaluationInputs inputs = EvaluationInputs.from(gson, distinctId, featureFlagContext);

        final FlagSnapshot snapshot = store == null ? null : store.current();
        final long version = snapshot == null ? 0 : snapshot.version();

        // If we have local flags and this flag can be evaluated locally always prioritize that
        FeatureFlagState result = null;
        boolean locallyEvaluated = false;
        final Flag flag = snapshot == null ? null : snapshot.flag(featureFlagKey);
        if (flag != null) {
            try {
                final FlagValue value = DependencyAwareEvaluator.evaluateSingle(snapshot, inputs, flag);
                result = FeatureFlagEvaluator.stateFor(flag, value);
                locallyEvaluated = true;
                resultCache.setCachedFlag(distinctId, featureFlagKey, result, version);
            } catch (InconclusiveMatchException e) {
                log.debug("failed to evaluate flag '{}' locally: {}", featureFlagKey, e.getMessage());
            }
        }

        String requestId = null;
        final List<String> errors = new ArrayList<>();
        if (result == null && isRemoteEvaluationAllowed(featureFlagContext)) {
            result = resultCache.getCachedFlag(distinctId, featureFlagKey, version);
            if (result == null) {
                try {
                    final RemoteEvaluation evaluation = remoteEvaluator.evaluate(distinctId, featureFlagContext);
                    requestId = evaluation.requestId();
                    if (evaluation.errorsWhileComputingFlags()) errors.add(ERROR_COMPUTING_FLAGS);

                    result = evaluation.states().get(featureFlagKey);
                    if (result != null) {
                        resultCache.setCachedFlag(distinctId, featureFlagKey, result, version);
                    } else errors.add(ERROR_FLAG_MISSING);
                } catch (RequestException e) {
                    log.warn("failed to evaluate flag '{}' remotely ({}), trying stale cache", featureFlagKey, e.errorMarker(), e);
                    errors.add(e.errorMarker());
                    result = resultCache.getStaleCachedFlag(distinctId, featureFlagKey);
                }
            }
        }

        // Send feature flag called event if configured to do so.
        final boolean sendCalledEvent = featureFlagContext.sendFeatureFlagEvents() != null
                ? featureFlagContext.sendFeatureFlagEvents()
                : this.sendFeatureFlagEvents;
        if (sendCalledEvent) {
            captureFeatureFlagCalled(featureFlagKey, inputs, result, locallyEvaluated, requestId,
                    errors.isEmpty() ? null : String.join(",", errors));
        }

        return result;
    }

    @Override
    public @NotNull FeatureFlagStates getAllFeatureFlags(@NotNull String distinctId, @Nullable FeatureFlagContext context) {
        nonNullNonEmpty("distinctId", distinctId);
        final FeatureFlagContext featureFlagContext = Objects.requireNonNullElse(context, FeatureFlagContext.EMPTY);
        final EvaluationInputs inputs = EvaluationInputs.from(gson, distinctId, featureFlagContext);
        final FlagSnapshot snapshot = store == null ? null : store.current();
        final long version = snapshot == null ? 0 : snapshot.version();

        // First try to evaluate all of the flags locally
        final Map<String, FeatureFlagState> result = new HashMap<>();
        if (snapshot != null) {
            final Map<String, FlagValue> values = DependencyAwareEvaluator.evaluate(snapshot, inputs, null);
            for (final Map.Entry<String, FlagValue> entry : values.entrySet()) {
                final FeatureFlagState state = FeatureFlagEvaluator.stateFor(snapshot.flag(entry.getKey()), entry.getValue());
                result.put(entry.getKey(), state);
                resultCache.setCachedFlag(distinctId, entry.getKey(), state, version);
            }
        }

        // If we are not allowed to do remote eval we must return whatever results we got.
        // Alternatively if we succeeded in evaluating all flags we are good to go.
        final boolean complete = snapshot != null && result.size() == snapshot.flagsByKey().size();
        if (complete || !isRemoteEvaluationAllowed(featureFlagContext)) {
            return new FeatureFlagStates(result);
        }

        try {
            final RemoteEvaluation evaluation = remoteEvaluator.evaluate(distinctId, featureFlagContext);
            for (final Map.Entry<String, FeatureFlagState> entry : evaluation.states().entrySet()) {
                result.put(entry.getKey(), entry.getValue());
                resultCache.setCachedFlag(distinctId, entry.getKey(), entry.getValue(), version);
            }
        } catch (RequestException e) {
            log.warn("failed to evaluate flags remotely ({}), using local and stale results", e.errorMarker(), e);
            if (snapshot != null) {
                for (final String key : snapshot.flagsByKey().keySet()) {
                    if (result.containsKey(key)) continue;
                    final FeatureFlagState stale = resultCache.getStaleCachedFlag(distinctId, key);
                    if (stale != null) result.put(key, stale);
                }
            }
        }
        return new FeatureFlagStates(result);
    }

    @Blocking
    @Override
    public void reloadFeatureFlags() {
        if (this.store == null)
            throw new IllegalStateException("Local feature flag evaluation is not enabled");
        this.store.load();
    }

    @Override
    public void applyFlagUpdate(@NotNull JsonObject patch) {
        if (this.store == null)
            throw new IllegalStateException("Local feature flag evaluation is not enabled");
        this.store.applyFlagUpdate(Objects.requireNonNull(patch));
    }

    @VisibleForTesting
    @Nullable FlagSnapshot currentSnapshot() {
        return store == null ? null : store.current();
    }

    private boolean isRemoteEvaluationAllowed(@NotNull FeatureFlagContext context) {
        if (remoteEvaluator == null) return false;
        return context.allowRemoteEvaluation() != null
                ? context.allowRemoteEvaluation()
                : this.allowRemoteFeatureFlagEvaluation;
    }

    private void loadFeatureFlags() {
        try {
            this.store.load();
        } catch (RuntimeException e) {
            log.error("failed to load flag definitions", e);
        }
    }

    private void captureFeatureFlagCalled(
            @NotNull String key, @NotNull EvaluationInputs inputs, @Nullable FeatureFlagState result,
            boolean locallyEvaluated, @Nullable String requestId, @Nullable String error
    ) {
        if (analyticsSink == null) return;

        final Object response = result == null ? null
                : Objects.requireNonNullElse(result.getVariant(), (Object) result.isEnabled());
        if (!trackCapturedFeatureFlagCall(inputs.distinctId(), key, response)) return;

        final Map<String, Object> properties = new HashMap<>();
        properties.put(FEATURE_FLAG, key);
        properties.put(FEATURE_FLAG_RESPONSE, response);
        properties.put(LOCALLY_EVALUATED, locallyEvaluated);
        properties.put(FEATURE_FLAG_PROPERTY_PREFIX + key, response);
        if (result != null && result.getPayload() != null) properties.put(FEATURE_FLAG_PAYLOAD, result.getPayload());
        if (requestId != null) properties.put(FEATURE_FLAG_REQUEST_ID, requestId);
        if (error != null) properties.put(FEATURE_FLAG_ERROR, error);

        try {
            analyticsSink.sendEvent(FEATURE_FLAG_CALLED, inputs.distinctId(), properties, inputs.groups());
        } catch (RuntimeException e) {
            log.warn("failed to send {} event for '{}'", FEATURE_FLAG_CALLED, key, e);
        }
    }

    /**
     * Deduplicates recently sent distinctId/featureFlagKey/response combinations, kind of.
     *
     * <p>The map is cleared once it grows too large, so a combination may be reported again after that.
     * This only roughly reduces event volume when evaluating a ton of feature flags.</p>
     *
     * @return true if the combination has not been seen "recently".
     */
    private boolean trackCapturedFeatureFlagCall(@NotNull String distinctId, @NotNull String featureFlagKey, @Nullable Object response) {
        if (recentlyCapturedFeatureFlags.size() > RECENTLY_CAPTURED_LIMIT) {
            recentlyCapturedFeatureFlags.clear();
        }

        final String cacheKey = distinctId + "_" + featureFlagKey + "_" + response;
        return recentlyCapturedFeatureFlags.put(cacheKey, Boolean.TRUE) == null;
    }
}
