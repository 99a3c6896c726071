package net.hollowcube.flags;

import com.google.gson.JsonObject;
import net.hollowcube.flags.FlagDefinitions.Condition;
import net.hollowcube.flags.FlagDefinitions.Flag;
import net.hollowcube.flags.FlagDefinitions.Variant;
import net.hollowcube.flags.PropertyFilter.CohortFilter;
import net.hollowcube.flags.PropertyFilter.FlagFilter;
import net.hollowcube.flags.PropertyFilter.ValueFilter;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static net.hollowcube.flags.ConsistentHasher.VARIANT_SALT;
import static net.hollowcube.flags.ConsistentHasher.hash;

/**
 * Local feature flag evaluator.
 * <p>
 * One instance serves a single evaluation pass: flag dependency filters are answered from the results already
 * cached in its {@link DependencyGraph}, so flags must be evaluated in dependency order.
 * <p>
 * Heavily based on <a href="https://github.com/PostHog/posthog-go/blob/master/featureflags.go#L342">posthog-go</a>.
 */
final class FeatureFlagEvaluator {
    private static final Logger log = LoggerFactory.getLogger(FeatureFlagEvaluator.class);

    private final DependencyGraph graph;
    private final Map<String, String> idToKey;
    private final Map<String, PropertyGroup> cohorts;
    private final Map<String, String> groupTypeMapping;

    FeatureFlagEvaluator(
            @NotNull DependencyGraph graph, @NotNull Map<String, String> idToKey,
            @NotNull Map<String, PropertyGroup> cohorts, @NotNull Map<String, String> groupTypeMapping
    ) {
        this.graph = graph;
        this.idToKey = idToKey;
        this.cohorts = cohorts;
        this.groupTypeMapping = groupTypeMapping;
    }

    /**
     * Evaluates a flag for the subject described by the inputs, selecting the group for group flags.
     *
     * <p>A group flag whose group type is unknown, or whose group was not supplied, does not match.</p>
     */
    @NotNull FlagValue evaluate(@NotNull Flag flag, @NotNull EvaluationInputs inputs) throws InconclusiveMatchException {
        final Integer groupTypeIndex = flag.filters().aggregationGroupTypeIndex();
        if (groupTypeIndex == null)
            return evaluate(flag, inputs.distinctId(), inputs.personProperties());

        final String groupName = groupTypeMapping.get(String.valueOf(groupTypeIndex));
        if (groupName == null || !inputs.groups().containsKey(groupName)) {
            log.debug("cannot evaluate group flag '{}' without group type {}", flag.key(), groupName == null ? groupTypeIndex : groupName);
            return FlagValue.FALSE;
        }

        final JsonObject groupProperties = inputs.groupProperties().get(groupName);
        return evaluate(flag, inputs.groups().get(groupName), groupProperties != null ? groupProperties : new JsonObject());
    }

    /**
     * Evaluates a flag against a single identity and property bag.
     *
     * @param identity   distinct id for person flags, group key for group flags
     * @param properties the person (or group) properties
     */
    @NotNull FlagValue evaluate(@NotNull Flag flag, @NotNull String identity, @NotNull JsonObject properties) throws InconclusiveMatchException {
        if (!flag.active()) return FlagValue.FALSE;

        boolean inconclusive = false;
        for (final Condition condition : flag.filters().groups()) {
            try {
                if (!isConditionMatch(flag, identity, condition, properties)) continue;

                final String variantOverride = condition.variant();
                if (variantOverride != null && hasVariant(flag, variantOverride))
                    return FlagValue.variant(variantOverride);
                return getMatchingVariant(flag, identity);
            } catch (InconclusiveMatchException e) {
                log.debug("failed to match condition of flag '{}' locally: {}", flag.key(), e.getMessage());
                inconclusive = true;
            }
        }

        // False is only a valid answer if no condition was inconclusive
        if (inconclusive)
            throw new InconclusiveMatchException("can't determine if flag '" + flag.key() + "' is enabled with the given properties");
        return FlagValue.FALSE;
    }

    private boolean isConditionMatch(
            @NotNull Flag flag, @NotNull String identity,
            @NotNull Condition condition, @NotNull JsonObject properties
    ) throws InconclusiveMatchException {
        for (final PropertyFilter filter : condition.propertiesOrEmpty()) {
            final boolean matches;
            if (filter instanceof CohortFilter cohort) {
                matches = matchCohort(cohort, properties);
            } else if (filter instanceof FlagFilter dependency) {
                matches = matchFlagDependency(dependency, dependency.negation());
            } else {
                matches = PropertyMatcher.match((ValueFilter) filter, properties);
            }
            if (!matches) return false;
        }

        final Double rolloutPercentage = condition.rolloutPercentage();
        return rolloutPercentage == null || hash(flag.key(), identity) <= rolloutPercentage / 100.0;
    }

    /**
     * Matches a flag dependency filter against the result cached for the dependency in this pass.
     *
     * <p>An invalid filter never matches, whether or not it is negated.</p>
     */
    private boolean matchFlagDependency(@NotNull FlagFilter filter, boolean negate) throws InconclusiveMatchException {
        final FlagValue expected = filter.expected();
        if (expected == null) {
            log.warn("invalid value {} for dependency on flag '{}', expected a boolean or variant", filter.value(), filter.flagId());
            return false;
        }
        if (!FlagFilter.FLAG_EVALUATES_TO.equals(filter.operator())) {
            log.warn("unsupported operator '{}' for dependency on flag '{}', only '{}' is supported",
                    filter.operator(), filter.flagId(), FlagFilter.FLAG_EVALUATES_TO);
            return false;
        }

        final String dependencyKey = DependencyGraph.resolveKey(filter.flagId(), idToKey, graph.getFlags());
        if (dependencyKey == null)
            throw new InconclusiveMatchException("flag dependency '" + filter.flagId() + "' does not exist");
        final FlagValue actual = graph.getCachedResult(dependencyKey);
        if (actual == null)
            throw new InconclusiveMatchException("flag dependency '" + dependencyKey + "' could not be evaluated");

        return negate != actual.satisfies(expected);
    }

    private boolean matchCohort(@NotNull CohortFilter filter, @NotNull JsonObject properties) throws InconclusiveMatchException {
        final PropertyGroup cohort = cohorts.get(filter.cohortId());
        if (cohort == null)
            throw new InconclusiveMatchException("can't match cohort '" + filter.cohortId() + "' without its definition");
        return matchPropertyGroup(cohort, properties);
    }

    private boolean matchPropertyGroup(@NotNull PropertyGroup group, @NotNull JsonObject properties) throws InconclusiveMatchException {
        if (group.isEmpty()) return true;

        final boolean and = group.type() == PropertyGroup.Type.AND;
        boolean inconclusive = false;
        if (!group.groups().isEmpty()) {
            for (final PropertyGroup nested : group.groups()) {
                try {
                    final boolean matches = matchPropertyGroup(nested, properties);
                    if (and && !matches) return false;
                    if (!and && matches) return true;
                } catch (InconclusiveMatchException e) {
                    log.debug("failed to match property group locally: {}", e.getMessage());
                    inconclusive = true;
                }
            }
        } else {
            for (final PropertyFilter filter : group.filters()) {
                try {
                    final boolean matches;
                    if (filter instanceof CohortFilter cohort) {
                        matches = matchCohort(cohort, properties);
                    } else if (filter instanceof FlagFilter dependency) {
                        matches = matchFlagDependency(dependency, false);
                    } else {
                        matches = PropertyMatcher.match((ValueFilter) filter, properties);
                    }

                    final boolean effective = filter.negation() != matches;
                    if (and && !effective) return false;
                    if (!and && effective) return true;
                } catch (InconclusiveMatchException e) {
                    log.debug("failed to match cohort property locally: {}", e.getMessage());
                    inconclusive = true;
                }
            }
        }

        if (inconclusive)
            throw new InconclusiveMatchException("can't match cohort without a given cohort property value");
        // All matched for AND, none matched for OR
        return and;
    }

    private static @NotNull FlagValue getMatchingVariant(@NotNull Flag flag, @NotNull String identity) {
        final List<Variant> variants = flag.filters().variants();
        if (variants.isEmpty()) return FlagValue.TRUE;

        final double value = hash(flag.key(), identity, VARIANT_SALT);
        double valueMin = 0;
        for (final Variant variant : variants) {
            final double valueMax = valueMin + (variant.rolloutPercentage() / 100.0);
            if (value >= valueMin && value < valueMax)
                return FlagValue.variant(variant.key());
            valueMin = valueMax;
        }

        // Percentages do not add up to 100
        return FlagValue.TRUE;
    }

    private static boolean hasVariant(@NotNull Flag flag, @NotNull String key) {
        for (final Variant variant : flag.filters().variants()) {
            if (variant.key().equals(key))
                return true;
        }
        return false;
    }

    /**
     * Builds the state for a locally evaluated value, attaching the payload configured for that value if any.
     */
    static @NotNull FeatureFlagState stateFor(@NotNull Flag flag, @NotNull FlagValue value) {
        if (!value.isEnabled()) return FeatureFlagState.DISABLED;
        final String payloadKey = value.variant() != null ? value.variant() : "true";
        return new FeatureFlagState(value, FeatureFlagState.payloadString(flag.filters().payloads().get(payloadKey)));
    }
}
