package net.hollowcube.flags;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A cohort definition: an AND/OR combination of either nested groups or property filters (never both).
 */
record PropertyGroup(@NotNull Type type, @NotNull List<PropertyGroup> groups, @NotNull List<PropertyFilter> filters) {

    enum Type {AND, OR}

    boolean isEmpty() {
        return groups.isEmpty() && filters.isEmpty();
    }

    static @NotNull PropertyGroup parse(@NotNull Gson gson, @NotNull JsonObject json) {
        final Type type = json.has("type") && "OR".equals(json.get("type").getAsString().toUpperCase(Locale.ROOT))
                ? Type.OR : Type.AND;
        if (!(json.get("values") instanceof JsonArray values) || values.isEmpty())
            return new PropertyGroup(type, List.of(), List.of());

        if (values.get(0) instanceof JsonObject first && first.has("values")) {
            final List<PropertyGroup> groups = new ArrayList<>(values.size());
            for (final JsonElement value : values) {
                if (!(value instanceof JsonObject nested))
                    throw new JsonParseException("property group values must be objects, got " + value);
                groups.add(parse(gson, nested));
            }
            return new PropertyGroup(type, List.copyOf(groups), List.of());
        }

        final List<PropertyFilter> filters = new ArrayList<>(values.size());
        for (final JsonElement value : values)
            filters.add(gson.fromJson(value, PropertyFilter.class));
        return new PropertyGroup(type, List.of(), List.copyOf(filters));
    }
}
