package net.hollowcube.flags;

import com.google.gson.*;
import com.google.gson.annotations.JsonAdapter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * A single filter inside a condition group or cohort, discriminated by its {@code type} when parsed.
 */
@JsonAdapter(PropertyFilter.Adapter.class)
public sealed interface PropertyFilter permits PropertyFilter.ValueFilter, PropertyFilter.CohortFilter, PropertyFilter.FlagFilter {

    boolean negation();

    /**
     * Compares a property from the person (or group) property bag.
     */
    record ValueFilter(
            @NotNull String key,
            @NotNull String type,
            @NotNull PropertyOperator operator,
            @NotNull JsonElement value,
            @Nullable Integer groupTypeIndex,
            boolean negation
    ) implements PropertyFilter {
        public ValueFilter {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(operator, "operator");
            value = Objects.requireNonNullElse(value, JsonNull.INSTANCE);
        }
    }

    /**
     * Requires membership of the cohort with the given id.
     */
    record CohortFilter(@NotNull String cohortId, boolean negation) implements PropertyFilter {
    }

    /**
     * Requires another flag (referenced by id) to have evaluated to the given value.
     */
    record FlagFilter(
            @NotNull String flagId,
            @NotNull JsonElement value,
            @NotNull String operator,
            boolean negation
    ) implements PropertyFilter {
        static final String FLAG_EVALUATES_TO = "flag_evaluates_to";

        public FlagFilter {
            Objects.requireNonNull(flagId, "flagId");
            value = Objects.requireNonNullElse(value, JsonNull.INSTANCE);
        }

        /**
         * @return the expected flag value, or null if the filter value is not a boolean or variant string
         */
        public @Nullable FlagValue expected() {
            return FlagValue.fromJson(value);
        }
    }

    final class Adapter implements JsonSerializer<PropertyFilter>, JsonDeserializer<PropertyFilter> {

        @Override
        public PropertyFilter deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context) throws JsonParseException {
            if (!(json instanceof JsonObject object))
                throw new JsonParseException("property filter must be an object, got " + json);

            final String type = string(object, "type", "person");
            final JsonElement value = object.has("value") ? object.get("value") : JsonNull.INSTANCE;
            final boolean negation = object.get("negation") instanceof JsonPrimitive p && p.isBoolean() && p.getAsBoolean();
            return switch (type) {
                case "cohort" -> {
                    if (!(value instanceof JsonPrimitive id))
                        throw new JsonParseException("cohort filter requires a cohort id, got " + value);
                    yield new CohortFilter(id.getAsString(), negation);
                }
                case "flag" -> new FlagFilter(requiredKey(object), value,
                        string(object, "operator", FlagFilter.FLAG_EVALUATES_TO), negation);
                default -> {
                    final JsonElement groupTypeIndex = object.get("group_type_index");
                    yield new ValueFilter(requiredKey(object), type,
                            PropertyOperator.fromName(string(object, "operator", null)), value,
                            groupTypeIndex instanceof JsonPrimitive p ? p.getAsInt() : null, negation);
                }
            };
        }

        @Override
        public JsonElement serialize(PropertyFilter src, Type typeOfSrc, JsonSerializationContext context) {
            final JsonObject object = new JsonObject();
            if (src instanceof ValueFilter f) {
                object.addProperty("key", f.key());
                object.addProperty("type", f.type());
                object.addProperty("operator", f.operator().wireName());
                object.add("value", f.value());
                if (f.groupTypeIndex() != null) object.addProperty("group_type_index", f.groupTypeIndex());
            } else if (src instanceof CohortFilter f) {
                object.addProperty("key", "id");
                object.addProperty("type", "cohort");
                object.addProperty("value", f.cohortId());
            } else if (src instanceof FlagFilter f) {
                object.addProperty("key", f.flagId());
                object.addProperty("type", "flag");
                object.addProperty("operator", f.operator());
                object.add("value", f.value());
            }
            if (src.negation()) object.addProperty("negation", true);
            return object;
        }

        private static @NotNull String requiredKey(@NotNull JsonObject object) {
            final String key = string(object, "key", null);
            if (key == null || key.isEmpty())
                throw new JsonParseException("property filter is missing a key: " + object);
            return key;
        }

        private static @Nullable String string(@NotNull JsonObject object, @NotNull String name, @Nullable String defaultValue) {
            return object.get(name) instanceof JsonPrimitive p ? p.getAsString() : defaultValue;
        }
    }
}
