package net.hollowcube.flags;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Everything known about the subject of an evaluation, already converted to JSON property bags.
 *
 * @param groups          group type name to group key
 * @param groupProperties group type name to that group's properties
 */
record EvaluationInputs(
        @NotNull String distinctId,
        @NotNull JsonObject personProperties,
        @NotNull Map<String, String> groups,
        @NotNull Map<String, JsonObject> groupProperties
) {
    static final String DISTINCT_ID_PROPERTY = "distinct_id";
    static final String GROUP_KEY_PROPERTY = "$group_key";

    static @NotNull EvaluationInputs of(@NotNull String distinctId, @NotNull JsonObject personProperties) {
        return new EvaluationInputs(distinctId, personProperties, Map.of(), Map.of());
    }

    /**
     * Converts a caller supplied context. The distinct id and group keys are added to the respective property
     * bags (unless the caller already provided them) so that filters on them can be evaluated locally.
     */
    static @NotNull EvaluationInputs from(@NotNull Gson gson, @NotNull String distinctId, @NotNull FeatureFlagContext context) {
        final JsonObject personProperties = new JsonObject();
        personProperties.addProperty(DISTINCT_ID_PROPERTY, distinctId);
        copyInto(personProperties, toObject(gson, context.personProperties(), "person properties"));

        final Map<String, String> groups = context.groups() == null ? Map.of() : Map.copyOf(context.groups());
        final Map<String, JsonObject> groupProperties = new HashMap<>();
        for (final Map.Entry<String, String> group : groups.entrySet()) {
            final JsonObject properties = new JsonObject();
            properties.addProperty(GROUP_KEY_PROPERTY, group.getValue());
            groupProperties.put(group.getKey(), properties);
        }
        if (context.groupProperties() != null) {
            for (final Map.Entry<String, Object> entry : context.groupProperties().entrySet()) {
                final JsonObject properties = groupProperties.computeIfAbsent(entry.getKey(), k -> new JsonObject());
                copyInto(properties, toObject(gson, entry.getValue(), "group properties"));
            }
        }

        return new EvaluationInputs(distinctId, personProperties, groups, Map.copyOf(groupProperties));
    }

    private static @Nullable JsonObject toObject(@NotNull Gson gson, @Nullable Object value, @NotNull String name) {
        if (value == null) return null;
        final JsonElement element = value instanceof JsonElement e ? e : gson.toJsonTree(value);
        if (element.isJsonNull()) return null;
        if (!(element instanceof JsonObject object))
            throw new IllegalArgumentException(name + " must serialize to a JSON object");
        return object;
    }

    private static void copyInto(@NotNull JsonObject target, @Nullable JsonObject source) {
        if (source == null) return;
        for (final Map.Entry<String, JsonElement> entry : source.entrySet())
            target.add(entry.getKey(), entry.getValue());
    }
}
