package net.hollowcube.flags;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import net.hollowcube.flags.PropertyFilter.ValueFilter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;

import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static net.hollowcube.flags.PropertyOperator.*;

/**
 * Matches a single person or group property filter against a property bag.
 * <p>
 * Semantics follow <a href="https://github.com/PostHog/posthog-python/blob/master/posthog/feature_flags.py">posthog-python</a>
 * so that local and remote evaluation agree.
 */
final class PropertyMatcher {
    private static final Pattern RELATIVE_DATE = Pattern.compile("^-?([0-9]+)([a-z])$");
    private static final int MAX_RELATIVE_DATE_AMOUNT = 10_000;

    static boolean match(@NotNull ValueFilter filter, @NotNull JsonObject properties) throws InconclusiveMatchException {
        return match(filter, properties, Instant.now());
    }

    @VisibleForTesting
    static boolean match(@NotNull ValueFilter filter, @NotNull JsonObject properties, @NotNull Instant now) throws InconclusiveMatchException {
        final String key = filter.key();
        final PropertyOperator operator = filter.operator();
        if (!properties.has(key)) {
            if (operator == IS_SET) return false;
            throw new InconclusiveMatchException("can't match property '" + key + "' without a given value");
        }
        if (operator == IS_NOT_SET)
            throw new InconclusiveMatchException("can't match properties with operator is_not_set");
        if (operator == UNKNOWN)
            throw new InconclusiveMatchException("unknown operator for property '" + key + "'");

        final JsonElement actual = properties.get(key);
        final JsonElement expected = filter.value();
        if (actual.isJsonNull() && operator != IS_NOT) return false;

        return switch (operator) {
            case EXACT -> exactMatch(expected, actual);
            case IS_NOT -> !exactMatch(expected, actual);
            case IS_SET -> true;
            case ICONTAINS -> icontains(actual, expected);
            case NOT_ICONTAINS -> !icontains(actual, expected);
            case REGEX -> {
                final Pattern pattern = compile(expected);
                yield pattern != null && pattern.matcher(asString(actual)).find();
            }
            case NOT_REGEX -> {
                // An invalid pattern is a non-match for both regex and not_regex
                final Pattern pattern = compile(expected);
                yield pattern != null && !pattern.matcher(asString(actual)).find();
            }
            case GT, GTE, LT, LTE -> compare(operator, actual, expected);
            case IS_DATE_BEFORE, IS_DATE_AFTER -> {
                final Instant target = parseFilterDate(expected, now);
                final Instant value = parsePropertyDate(actual);
                yield operator == IS_DATE_BEFORE ? value.isBefore(target) : value.isAfter(target);
            }
            case IS_NOT_SET, UNKNOWN -> throw new IllegalStateException("unreachable operator " + operator);
        };
    }

    private static boolean exactMatch(@NotNull JsonElement expected, @NotNull JsonElement actual) {
        final String actualValue = fold(actual);
        if (expected instanceof JsonArray array) {
            for (final JsonElement element : array) {
                if (fold(element).equals(actualValue))
                    return true;
            }
            return false;
        }
        return fold(expected).equals(actualValue);
    }

    private static boolean icontains(@NotNull JsonElement actual, @NotNull JsonElement expected) {
        return fold(actual).contains(fold(expected));
    }

    private static @Nullable Pattern compile(@NotNull JsonElement expected) {
        try {
            return Pattern.compile(asString(expected));
        } catch (PatternSyntaxException ignored) {
            return null;
        }
    }

    private static boolean compare(@NotNull PropertyOperator operator, @NotNull JsonElement actual, @NotNull JsonElement expected) {
        if (!(actual instanceof JsonPrimitive lhs) || !(expected instanceof JsonPrimitive rhs))
            return false;

        final int result;
        if (lhs.isNumber() && rhs.isNumber()) {
            result = Double.compare(lhs.getAsDouble(), rhs.getAsDouble());
        } else if (lhs.isString() && rhs.isString()) {
            result = lhs.getAsString().compareTo(rhs.getAsString());
        } else {
            return false;
        }

        return switch (operator) {
            case GT -> result > 0;
            case GTE -> result >= 0;
            case LT -> result < 0;
            case LTE -> result <= 0;
            default -> throw new IllegalArgumentException("not a comparison operator: " + operator);
        };
    }

    private static @NotNull Instant parseFilterDate(@NotNull JsonElement expected, @NotNull Instant now) throws InconclusiveMatchException {
        final String raw = asString(expected);
        final Matcher relative = RELATIVE_DATE.matcher(raw);
        if (relative.matches()) {
            final int amount;
            try {
                amount = Integer.parseInt(relative.group(1));
            } catch (NumberFormatException e) {
                throw new InconclusiveMatchException("the date set on the flag is not a valid format", e);
            }
            if (amount >= MAX_RELATIVE_DATE_AMOUNT)
                throw new InconclusiveMatchException("the date set on the flag is not a valid format");

            final ZonedDateTime base = now.atZone(ZoneOffset.UTC);
            return switch (relative.group(2)) {
                case "h" -> base.minusHours(amount).toInstant();
                case "d" -> base.minusDays(amount).toInstant();
                case "w" -> base.minusWeeks(amount).toInstant();
                case "m" -> base.minusMonths(amount).toInstant();
                case "y" -> base.minusYears(amount).toInstant();
                default -> throw new InconclusiveMatchException("the date set on the flag is not a valid format");
            };
        }

        final Instant absolute = parseIsoDate(raw);
        if (absolute == null)
            throw new InconclusiveMatchException("the date set on the flag is not a valid format");
        return absolute;
    }

    private static @NotNull Instant parsePropertyDate(@NotNull JsonElement actual) throws InconclusiveMatchException {
        if (!(actual instanceof JsonPrimitive primitive) || !primitive.isString())
            throw new InconclusiveMatchException("the date provided must be a string");
        final Instant value = parseIsoDate(primitive.getAsString());
        if (value == null)
            throw new InconclusiveMatchException("the date provided is not a valid format");
        return value;
    }

    /**
     * Parses an ISO-8601 date, local date-time or offset date-time. Values without an offset are taken as UTC.
     */
    static @Nullable Instant parseIsoDate(@NotNull String raw) {
        String value = raw.trim();
        if (value.length() > 10 && value.charAt(10) == ' ')
            value = value.substring(0, 10) + 'T' + value.substring(11);

        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ignored) {
            // Try the next format
        }
        try {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // Try the next format
        }
        try {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private static @NotNull String fold(@NotNull JsonElement element) {
        return asString(element).toLowerCase(Locale.ROOT);
    }

    private static @NotNull String asString(@NotNull JsonElement element) {
        if (element instanceof JsonPrimitive primitive) return primitive.getAsString();
        if (element.isJsonNull()) return "null";
        return element.toString();
    }

    private PropertyMatcher() {
    }
}
