package net.hollowcube.flags;

import net.hollowcube.flags.FlagDefinitions.Condition;
import net.hollowcube.flags.FlagDefinitions.Flag;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Directed graph of flag-to-flag dependencies, keyed by flag key.
 *
 * <p>An edge {@code a -> b} means that {@code a} depends on {@code b}, so {@code b} must be evaluated first.
 * Iteration order is insertion order everywhere so that sorting and cycle detection are deterministic.</p>
 *
 * <p>Each graph also carries the evaluation cache for a single evaluation pass. Instances are not thread safe,
 * a pass must work on its own instance (see {@link #copy()} and {@link #filterByKeys(Set)}).</p>
 */
final class DependencyGraph {
    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    record Built(@NotNull DependencyGraph graph, @NotNull Map<String, String> idToKey) {
    }

    private final Set<String> flags = new LinkedHashSet<>();
    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependents = new LinkedHashMap<>();
    private final Map<String, FlagValue> evaluationCache = new HashMap<>();

    /**
     * Builds the graph for a set of flag definitions along with the flag id to flag key mapping.
     *
     * <p>Dependencies on flags which do not exist are logged and dropped. Flags taking part in a cycle are
     * removed from the graph.</p>
     */
    static @NotNull Built build(@NotNull Collection<Flag> flags) {
        final DependencyGraph graph = new DependencyGraph();
        final Map<String, String> idToKey = new LinkedHashMap<>();
        for (final Flag flag : flags) {
            graph.addFlag(flag.key());
            if (flag.id() != null) idToKey.put(String.valueOf(flag.id()), flag.key());
        }

        for (final Flag flag : flags) {
            for (final String dependencyId : extractFlagDependencies(flag)) {
                final String dependencyKey = resolveKey(dependencyId, idToKey, graph.flags);
                if (dependencyKey != null) {
                    graph.addDependency(flag.key(), dependencyKey);
                } else {
                    log.warn("flag '{}' depends on missing flag id '{}', the dependency will be ignored", flag.key(), dependencyId);
                }
            }
        }

        if (graph.hasCycles()) {
            final List<String> removed = graph.removeCycles();
            log.warn("removed flags due to cyclic dependencies: {}", removed);
        }
        return new Built(graph, Map.copyOf(idToKey));
    }

    /**
     * Collects the ids of every flag referenced by a {@code flag} type filter in any condition group of the flag.
     */
    static @NotNull Set<String> extractFlagDependencies(@NotNull Flag flag) {
        final Set<String> result = new LinkedHashSet<>();
        for (final Condition condition : flag.filters().groups()) {
            for (final PropertyFilter filter : condition.propertiesOrEmpty()) {
                if (filter instanceof PropertyFilter.FlagFilter flagFilter)
                    result.add(flagFilter.flagId());
            }
        }
        return result;
    }

    /**
     * Translates a flag id into a flag key. For compatibility a dependency may also reference a key directly.
     */
    static @Nullable String resolveKey(@NotNull String flagId, @NotNull Map<String, String> idToKey, @NotNull Collection<String> knownKeys) {
        final String key = idToKey.get(flagId);
        if (key != null) return key;
        return knownKeys.contains(flagId) ? flagId : null;
    }

    void addFlag(@NotNull String flagKey) {
        flags.add(flagKey);
    }

    void addDependency(@NotNull String flagKey, @NotNull String dependencyKey) {
        flags.add(flagKey);
        flags.add(dependencyKey);
        dependencies.computeIfAbsent(flagKey, k -> new LinkedHashSet<>()).add(dependencyKey);
        dependents.computeIfAbsent(dependencyKey, k -> new LinkedHashSet<>()).add(flagKey);
    }

    @NotNull Set<String> getFlags() {
        return Collections.unmodifiableSet(flags);
    }

    boolean contains(@NotNull String flagKey) {
        return flags.contains(flagKey);
    }

    @NotNull Set<String> getDependencies(@NotNull String flagKey) {
        return Collections.unmodifiableSet(dependencies.getOrDefault(flagKey, Set.of()));
    }

    @NotNull Set<String> getDependents(@NotNull String flagKey) {
        return Collections.unmodifiableSet(dependents.getOrDefault(flagKey, Set.of()));
    }

    boolean hasCycles() {
        try {
            topologicalSort();
            return false;
        } catch (CyclicDependencyException e) {
            return true;
        }
    }

    /**
     * Orders the flags so that every flag comes after all of its dependencies (Kahn's algorithm).
     *
     * @throws CyclicDependencyException if some flags could not be ordered because of a cycle
     */
    @NotNull List<String> topologicalSort() throws CyclicDependencyException {
        final Map<String, Integer> inDegree = new HashMap<>();
        final Deque<String> queue = new ArrayDeque<>();
        for (final String flag : flags) {
            final int degree = dependencies.getOrDefault(flag, Set.of()).size();
            inDegree.put(flag, degree);
            if (degree == 0) queue.add(flag);
        }

        final List<String> result = new ArrayList<>(flags.size());
        while (!queue.isEmpty()) {
            final String flag = queue.poll();
            result.add(flag);
            for (final String dependent : dependents.getOrDefault(flag, Set.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0)
                    queue.add(dependent);
            }
        }

        if (result.size() != flags.size()) {
            for (final String flag : flags) {
                if (inDegree.get(flag) > 0) throw new CyclicDependencyException(flag);
            }
        }
        return result;
    }

    /**
     * Finds every flag which is part of a cycle using an iterative depth first search.
     *
     * <p>Flags which only depend on a cycle (without being part of it) are not included.</p>
     */
    @NotNull List<String> detectCycles() {
        final Set<String> visited = new HashSet<>();
        final Set<String> onStack = new HashSet<>();
        final Set<String> cycleFlags = new LinkedHashSet<>();

        record Frame(String flag, Iterator<String> next) {
        }

        for (final String root : flags) {
            if (visited.contains(root)) continue;

            final List<Frame> stack = new ArrayList<>();
            stack.add(new Frame(root, dependencies.getOrDefault(root, Set.of()).iterator()));
            visited.add(root);
            onStack.add(root);

            while (!stack.isEmpty()) {
                final Frame top = stack.get(stack.size() - 1);
                if (!top.next().hasNext()) {
                    stack.remove(stack.size() - 1);
                    onStack.remove(top.flag());
                    continue;
                }

                final String dependency = top.next().next();
                if (onStack.contains(dependency)) {
                    // Everything on the stack from the dependency upwards forms the cycle
                    for (int i = stack.size() - 1; i >= 0; i--) {
                        final String member = stack.get(i).flag();
                        cycleFlags.add(member);
                        if (member.equals(dependency)) break;
                    }
                } else if (visited.add(dependency)) {
                    onStack.add(dependency);
                    stack.add(new Frame(dependency, dependencies.getOrDefault(dependency, Set.of()).iterator()));
                }
            }
        }

        return List.copyOf(cycleFlags);
    }

    /**
     * Removes every flag which takes part in a cycle until the graph is acyclic.
     *
     * @return the removed flags, in removal order
     */
    @NotNull List<String> removeCycles() {
        final List<String> removed = new ArrayList<>();
        List<String> cycleFlags;
        while (!(cycleFlags = detectCycles()).isEmpty()) {
            for (final String flag : cycleFlags) {
                removeFlag(flag);
                log.warn("removed flag '{}' due to cyclic dependency", flag);
            }
            removed.addAll(cycleFlags);
        }
        return removed;
    }

    void removeFlag(@NotNull String flagKey) {
        if (!flags.remove(flagKey)) return;

        for (final String dependency : dependencies.getOrDefault(flagKey, Set.of())) {
            final Set<String> set = dependents.get(dependency);
            if (set != null) set.remove(flagKey);
        }
        for (final String dependent : dependents.getOrDefault(flagKey, Set.of())) {
            final Set<String> set = dependencies.get(dependent);
            if (set != null) set.remove(flagKey);
        }
        dependencies.remove(flagKey);
        dependents.remove(flagKey);
        evaluationCache.remove(flagKey);
    }

    /**
     * Creates a new graph containing only the requested flags and everything they (transitively) depend on.
     *
     * <p>Requested keys which are not part of this graph are ignored.</p>
     */
    @NotNull DependencyGraph filterByKeys(@NotNull Set<String> requestedKeys) {
        final Set<String> required = new HashSet<>();
        final Deque<String> queue = new ArrayDeque<>();
        for (final String key : requestedKeys) {
            if (flags.contains(key) && required.add(key)) queue.add(key);
        }
        while (!queue.isEmpty()) {
            for (final String dependency : dependencies.getOrDefault(queue.poll(), Set.of())) {
                if (required.add(dependency)) queue.add(dependency);
            }
        }

        final DependencyGraph filtered = new DependencyGraph();
        for (final String flag : flags) {
            if (!required.contains(flag)) continue;
            filtered.addFlag(flag);
            for (final String dependency : dependencies.getOrDefault(flag, Set.of())) {
                if (required.contains(dependency)) filtered.addDependency(flag, dependency);
            }
        }
        return filtered;
    }

    /**
     * @return a structural copy of this graph with an empty evaluation cache
     */
    @NotNull DependencyGraph copy() {
        final DependencyGraph copy = new DependencyGraph();
        for (final String flag : flags) {
            copy.addFlag(flag);
            for (final String dependency : dependencies.getOrDefault(flag, Set.of()))
                copy.addDependency(flag, dependency);
        }
        return copy;
    }

    void cacheResult(@NotNull String flagKey, @NotNull FlagValue result) {
        evaluationCache.put(flagKey, result);
    }

    @Nullable FlagValue getCachedResult(@NotNull String flagKey) {
        return evaluationCache.get(flagKey);
    }

    void clearCache() {
        evaluationCache.clear();
    }
}
