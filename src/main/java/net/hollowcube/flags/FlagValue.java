package net.hollowcube.flags;

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The resolved value of a feature flag: either a boolean or the key of a variant.
 *
 * <p>{@code true} and any variant are considered enabled.</p>
 */
public sealed interface FlagValue permits FlagValue.Bool, FlagValue.Variant {
    @NotNull FlagValue TRUE = new Bool(true);
    @NotNull FlagValue FALSE = new Bool(false);

    static @NotNull FlagValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static @NotNull FlagValue variant(@NotNull String key) {
        return new Variant(key);
    }

    /**
     * Converts a JSON flag value ({@code true}, {@code false} or a variant string) into a {@link FlagValue}.
     *
     * @return the value, or null if the element is neither a boolean nor a non-empty string
     */
    static @Nullable FlagValue fromJson(@Nullable JsonElement element) {
        if (!(element instanceof JsonPrimitive primitive)) return null;
        if (primitive.isBoolean()) return of(primitive.getAsBoolean());
        if (primitive.isString() && !primitive.getAsString().isEmpty())
            return variant(primitive.getAsString());
        return null;
    }

    boolean isEnabled();

    @Nullable String variant();

    @NotNull JsonElement toJson();

    /**
     * Tests this (actual) value against the value expected by a flag dependency filter.
     *
     * <ul>
     *     <li>{@code true} matches any enabled value</li>
     *     <li>{@code false} matches only {@code false}</li>
     *     <li>a variant matches only the same variant (case-sensitive)</li>
     * </ul>
     */
    default boolean satisfies(@NotNull FlagValue expected) {
        if (expected instanceof Variant v) return Objects.equals(variant(), v.key());
        return expected.isEnabled() == isEnabled();
    }

    record Bool(boolean value) implements FlagValue {
        @Override
        public boolean isEnabled() {
            return value;
        }

        @Override
        public @Nullable String variant() {
            return null;
        }

        @Override
        public @NotNull JsonElement toJson() {
            return new JsonPrimitive(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record Variant(@NotNull String key) implements FlagValue {
        public Variant {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public boolean isEnabled() {
            return true;
        }

        @Override
        public @NotNull String variant() {
            return key;
        }

        @Override
        public @NotNull JsonElement toJson() {
            return new JsonPrimitive(key);
        }

        @Override
        public String toString() {
            return key;
        }
    }
}
