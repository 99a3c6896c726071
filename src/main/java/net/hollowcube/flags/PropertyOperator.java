package net.hollowcube.flags;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * The closed set of operators a person or group property filter may use.
 */
public enum PropertyOperator {
    EXACT,
    IS_NOT,
    IS_SET,
    IS_NOT_SET,
    ICONTAINS,
    NOT_ICONTAINS,
    REGEX,
    NOT_REGEX,
    GT,
    GTE,
    LT,
    LTE,
    IS_DATE_BEFORE,
    IS_DATE_AFTER,
    /**
     * Any operator this client does not understand. Never matches conclusively.
     */
    UNKNOWN;

    /**
     * Parses the wire name of an operator. A missing operator means {@link #EXACT}.
     */
    static @NotNull PropertyOperator fromName(@Nullable String name) {
        if (name == null || name.isEmpty()) return EXACT;
        for (final PropertyOperator operator : values()) {
            if (operator != UNKNOWN && operator.wireName().equals(name))
                return operator;
        }
        return UNKNOWN;
    }

    @NotNull String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
