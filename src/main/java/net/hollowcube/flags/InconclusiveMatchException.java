package net.hollowcube.flags;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a flag cannot be evaluated locally with the data available, for example because a property
 * referenced by a filter was not supplied. Callers must fall back to remote evaluation, never treat it as false.
 */
public final class InconclusiveMatchException extends Exception {

    public InconclusiveMatchException(@NotNull String message) {
        super(message);
    }

    public InconclusiveMatchException(@NotNull String message, @NotNull Throwable cause) {
        super(message, cause);
    }
}
