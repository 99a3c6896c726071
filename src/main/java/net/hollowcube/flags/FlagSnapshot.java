package net.hollowcube.flags;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import net.hollowcube.flags.FlagDefinitions.Flag;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * An immutable, versioned view of one set of flag definitions with everything derived from it.
 *
 * <p>Snapshots are swapped in atomically on reload, so evaluations always see one complete set.</p>
 */
final class FlagSnapshot {
    private static final Logger log = LoggerFactory.getLogger(FlagSnapshot.class);

    private final long version;
    private final FlagDefinitions definitions;
    private final Map<String, Flag> flagsByKey;
    private final Map<String, String> idToKey;
    private final Map<String, PropertyGroup> cohorts;
    private final DependencyGraph graph; // Never evaluated against directly, only copied
    private final boolean hasDependencies;

    private FlagSnapshot(long version, @NotNull FlagDefinitions definitions, @NotNull Map<String, PropertyGroup> cohorts) {
        this.version = version;
        this.definitions = definitions;

        final Map<String, Flag> flagsByKey = new LinkedHashMap<>();
        boolean hasDependencies = false;
        for (final Flag flag : definitions.flags()) {
            flagsByKey.put(flag.key(), flag);
            hasDependencies |= !DependencyGraph.extractFlagDependencies(flag).isEmpty();
        }
        this.flagsByKey = Collections.unmodifiableMap(flagsByKey);
        this.hasDependencies = hasDependencies;
        this.cohorts = cohorts;

        final DependencyGraph.Built built = DependencyGraph.build(flagsByKey.values());
        this.graph = built.graph();
        this.idToKey = built.idToKey();
    }

    static @NotNull FlagSnapshot build(@NotNull Gson gson, @NotNull FlagDefinitions definitions, long version) {
        return new FlagSnapshot(version, definitions, parseCohorts(gson, definitions.cohorts()));
    }

    /**
     * @return a new snapshot with the flag inserted, or replacing the flag with the same key
     */
    @NotNull FlagSnapshot withFlag(@NotNull Flag flag, long newVersion) {
        final List<Flag> flags = new ArrayList<>(definitions.flags().size() + 1);
        boolean replaced = false;
        for (final Flag existing : definitions.flags()) {
            if (existing.key().equals(flag.key())) {
                if (!replaced) flags.add(flag);
                replaced = true;
            } else {
                flags.add(existing);
            }
        }
        if (!replaced) flags.add(flag);
        return withFlags(flags, newVersion);
    }

    /**
     * @return a new snapshot without the flag with the given key
     */
    @NotNull FlagSnapshot withoutFlag(@NotNull String key, long newVersion) {
        final List<Flag> flags = new ArrayList<>(definitions.flags());
        flags.removeIf(flag -> flag.key().equals(key));
        return withFlags(flags, newVersion);
    }

    private @NotNull FlagSnapshot withFlags(@NotNull List<Flag> flags, long newVersion) {
        final FlagDefinitions updated = new FlagDefinitions(flags, definitions.groupTypeMapping(), definitions.cohorts());
        return new FlagSnapshot(newVersion, updated, cohorts);
    }

    long version() {
        return version;
    }

    @NotNull FlagDefinitions definitions() {
        return definitions;
    }

    @Nullable Flag flag(@NotNull String key) {
        return flagsByKey.get(key);
    }

    @NotNull Map<String, Flag> flagsByKey() {
        return flagsByKey;
    }

    @NotNull Map<String, String> idToKey() {
        return idToKey;
    }

    @NotNull Map<String, PropertyGroup> cohorts() {
        return cohorts;
    }

    @NotNull Map<String, String> groupTypeMapping() {
        return definitions.groupTypeMapping();
    }

    boolean hasDependencies() {
        return hasDependencies;
    }

    boolean isEmpty() {
        return flagsByKey.isEmpty();
    }

    /**
     * @return a private copy of the dependency graph for one evaluation pass
     */
    @NotNull DependencyGraph newGraph() {
        return graph.copy();
    }

    /**
     * @return a private graph for one evaluation pass, restricted to the given flags and their dependencies
     */
    @NotNull DependencyGraph newGraph(@NotNull Set<String> requestedKeys) {
        return graph.filterByKeys(requestedKeys);
    }

    @NotNull FeatureFlagEvaluator newEvaluator(@NotNull DependencyGraph graph) {
        return new FeatureFlagEvaluator(graph, idToKey, cohorts, definitions.groupTypeMapping());
    }

    private static @NotNull Map<String, PropertyGroup> parseCohorts(@NotNull Gson gson, @NotNull Map<String, JsonObject> raw) {
        final Map<String, PropertyGroup> cohorts = new HashMap<>();
        for (final Map.Entry<String, JsonObject> entry : raw.entrySet()) {
            try {
                cohorts.put(entry.getKey(), PropertyGroup.parse(gson, entry.getValue()));
            } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
                log.warn("ignoring invalid definition of cohort {}", entry.getKey(), e);
            }
        }
        return Map.copyOf(cohorts);
    }
}
