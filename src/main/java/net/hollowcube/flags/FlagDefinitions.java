package net.hollowcube.flags;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A complete set of flag definitions as returned by the local evaluation endpoint.
 *
 * @param flags            all flag definitions, in the order they were returned
 * @param groupTypeMapping group type index (as a string) to group type name
 * @param cohorts          cohort id to its (unparsed) property group
 */
public record FlagDefinitions(
        @NotNull List<Flag> flags,
        @SerializedName("group_type_mapping")
        @NotNull Map<String, String> groupTypeMapping,
        @NotNull Map<String, JsonObject> cohorts
) {
    public static final FlagDefinitions EMPTY = new FlagDefinitions(List.of(), Map.of(), Map.of());

    public FlagDefinitions {
        flags = flags == null ? List.of() : List.copyOf(flags);
        groupTypeMapping = groupTypeMapping == null ? Map.of() : Map.copyOf(groupTypeMapping);
        cohorts = cohorts == null ? Map.of() : Map.copyOf(cohorts);
    }

    public record Flag(
            @Nullable Long id,
            @NotNull String key,
            boolean active,
            @SerializedName("ensure_experience_continuity")
            @Nullable Boolean ensureExperienceContinuity,
            @NotNull Filters filters
    ) {
        public Flag {
            Objects.requireNonNull(key, "flag key");
            filters = Objects.requireNonNullElse(filters, Filters.EMPTY);
        }

        boolean requiresExperienceContinuity() {
            return ensureExperienceContinuity != null && ensureExperienceContinuity;
        }
    }

    public record Filters(
            @NotNull List<Condition> groups,
            @Nullable Variants multivariate,
            @SerializedName("aggregation_group_type_index")
            @Nullable Integer aggregationGroupTypeIndex,
            @NotNull Map<String, JsonElement> payloads
    ) {
        static final Filters EMPTY = new Filters(List.of(), null, null, Map.of());

        public Filters {
            groups = groups == null ? List.of() : groups;
            payloads = payloads == null ? Map.of() : payloads;
        }

        @NotNull List<Variant> variants() {
            return multivariate == null || multivariate.variants() == null ? List.of() : multivariate.variants();
        }
    }

    public record Condition(
            @Nullable List<PropertyFilter> properties,
            @SerializedName("rollout_percentage")
            @Nullable Double rolloutPercentage,
            @Nullable String variant
    ) {
        @NotNull List<PropertyFilter> propertiesOrEmpty() {
            return properties == null ? List.of() : properties;
        }
    }

    public record Variants(@Nullable List<Variant> variants) {
    }

    public record Variant(
            @NotNull String key,
            @Nullable String name,
            @SerializedName("rollout_percentage")
            double rolloutPercentage
    ) {
    }
}
