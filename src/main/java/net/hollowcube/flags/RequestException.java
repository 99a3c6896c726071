package net.hollowcube.flags;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A failed request to PostHog, classified so that callers can decide between retrying, falling back to
 * stale data, or reporting the failure.
 */
public final class RequestException extends Exception {

    public enum Kind {
        TIMEOUT,
        CONNECTION,
        API_ERROR,
        QUOTA_LIMITED
    }

    private final Kind kind;
    private final int statusCode;

    public RequestException(@NotNull Kind kind, @NotNull String message) {
        this(kind, -1, message, null);
    }

    public RequestException(@NotNull Kind kind, @NotNull String message, @Nullable Throwable cause) {
        this(kind, -1, message, cause);
    }

    public RequestException(@NotNull Kind kind, int statusCode, @NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static @NotNull RequestException apiError(int statusCode, @NotNull String message) {
        return new RequestException(Kind.API_ERROR, statusCode, message, null);
    }

    public @NotNull Kind getKind() {
        return kind;
    }

    /**
     * @return the HTTP status code of the response, or -1 if there was no response
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return the value reported as {@code $feature_flag_error} for this failure
     */
    public @NotNull String errorMarker() {
        return switch (kind) {
            case TIMEOUT -> PostHogNames.ERROR_TIMEOUT;
            case CONNECTION -> PostHogNames.ERROR_CONNECTION;
            case QUOTA_LIMITED -> PostHogNames.ERROR_QUOTA_LIMITED;
            case API_ERROR -> statusCode > 0 ? PostHogNames.ERROR_API_PREFIX + statusCode : PostHogNames.ERROR_UNKNOWN;
        };
    }
}
