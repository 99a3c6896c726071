package net.hollowcube.flags;

import com.google.gson.JsonObject;
import net.hollowcube.flags.FlagDefinitions.Flag;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Evaluates flags in dependency order so that flag dependency filters can be answered from results
 * computed earlier in the same pass.
 *
 * <p>Every call works on its own {@link DependencyGraph}, so concurrent evaluations never share results.</p>
 */
final class DependencyAwareEvaluator {
    private static final Logger log = LoggerFactory.getLogger(DependencyAwareEvaluator.class);

    /**
     * Evaluates a raw list of flag definitions, building the dependency graph from scratch.
     *
     * @param requestedKeys if present, only these flags (and their dependencies) are evaluated
     * @return the value of every flag which could be evaluated locally. Inconclusive flags, and flags which
     * require experience continuity, are absent.
     */
    static @NotNull Map<String, FlagValue> evaluate(
            @NotNull List<Flag> flags,
            @NotNull String distinctId,
            @NotNull JsonObject properties,
            @NotNull Map<String, PropertyGroup> cohorts,
            @Nullable Set<String> requestedKeys,
            @Nullable Map<String, String> groups,
            @Nullable Map<String, JsonObject> groupProperties,
            @Nullable Map<String, String> groupTypeMapping
    ) {
        final Map<String, Flag> flagsByKey = new LinkedHashMap<>();
        for (final Flag flag : flags) flagsByKey.put(flag.key(), flag);

        final DependencyGraph.Built built = DependencyGraph.build(flagsByKey.values());
        final DependencyGraph graph = requestedKeys == null || requestedKeys.isEmpty()
                ? built.graph() : built.graph().filterByKeys(requestedKeys);
        final FeatureFlagEvaluator evaluator = new FeatureFlagEvaluator(graph, built.idToKey(), cohorts,
                Objects.requireNonNullElse(groupTypeMapping, Map.of()));
        final EvaluationInputs inputs = new EvaluationInputs(distinctId, properties,
                Objects.requireNonNullElse(groups, Map.of()), Objects.requireNonNullElse(groupProperties, Map.of()));
        return evaluateInOrder(graph, flagsByKey, evaluator, inputs);
    }

    /**
     * Evaluates the flags of a snapshot, reusing its pre-built dependency structure.
     */
    static @NotNull Map<String, FlagValue> evaluate(
            @NotNull FlagSnapshot snapshot, @NotNull EvaluationInputs inputs, @Nullable Set<String> requestedKeys
    ) {
        final DependencyGraph graph = requestedKeys == null || requestedKeys.isEmpty()
                ? snapshot.newGraph() : snapshot.newGraph(requestedKeys);
        return evaluateInOrder(graph, snapshot.flagsByKey(), snapshot.newEvaluator(graph), inputs);
    }

    /**
     * Evaluates a single flag of a snapshot.
     *
     * @throws InconclusiveMatchException if the flag (or one of its dependencies) cannot be evaluated locally
     */
    static @NotNull FlagValue evaluateSingle(
            @NotNull FlagSnapshot snapshot, @NotNull EvaluationInputs inputs, @NotNull Flag flag
    ) throws InconclusiveMatchException {
        if (flag.requiresExperienceContinuity())
            throw new InconclusiveMatchException("flag '" + flag.key() + "' requires experience continuity, cannot be evaluated locally");
        if (!snapshot.hasDependencies())
            return snapshot.newEvaluator(new DependencyGraph()).evaluate(flag, inputs);

        final FlagValue value = evaluate(snapshot, inputs, Set.of(flag.key())).get(flag.key());
        if (value == null)
            throw new InconclusiveMatchException("flag '" + flag.key() + "' or one of its dependencies could not be evaluated locally");
        return value;
    }

    private static @NotNull Map<String, FlagValue> evaluateInOrder(
            @NotNull DependencyGraph graph, @NotNull Map<String, Flag> flagsByKey,
            @NotNull FeatureFlagEvaluator evaluator, @NotNull EvaluationInputs inputs
    ) {
        List<String> order;
        try {
            order = graph.topologicalSort();
        } catch (CyclicDependencyException e) {
            // Cycles are removed when the graph is built
            log.error("unexpected cyclic dependency after cycle removal", e);
            order = List.copyOf(graph.getFlags());
        }

        graph.clearCache();
        final Map<String, FlagValue> results = new LinkedHashMap<>();
        for (final String key : order) {
            final Flag flag = flagsByKey.get(key);
            if (flag == null) continue;

            try {
                final FlagValue value = evaluator.evaluate(flag, inputs);
                graph.cacheResult(key, value);
                // Still usable as a dependency, but its own answer must come from the server
                if (!flag.requiresExperienceContinuity()) results.put(key, value);
            } catch (InconclusiveMatchException e) {
                log.debug("flag '{}' could not be evaluated locally: {}", key, e.getMessage());
            }
        }
        return results;
    }

    private DependencyAwareEvaluator() {
    }
}
