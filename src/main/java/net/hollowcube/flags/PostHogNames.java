package net.hollowcube.flags;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Names with special functionality in PostHog.
 */
public final class PostHogNames {
    // Feature flags
    public static final String FEATURE_FLAG_CALLED = "$feature_flag_called";
    public static final String FEATURE_FLAG = "$feature_flag";
    public static final String FEATURE_FLAG_RESPONSE = "$feature_flag_response";
    public static final String FEATURE_FLAG_PAYLOAD = "$feature_flag_payload";
    public static final String FEATURE_FLAG_REQUEST_ID = "$feature_flag_request_id";
    public static final String FEATURE_FLAG_ERROR = "$feature_flag_error";
    public static final String FEATURE_FLAG_PROPERTY_PREFIX = "$feature/";
    public static final String LOCALLY_EVALUATED = "locally_evaluated";

    // Values of $feature_flag_error, see RequestException for the transport related ones
    public static final String ERROR_COMPUTING_FLAGS = "errors_while_computing_flags";
    public static final String ERROR_FLAG_MISSING = "flag_missing";
    public static final String ERROR_QUOTA_LIMITED = "quota_limited";
    public static final String ERROR_TIMEOUT = "timeout";
    public static final String ERROR_CONNECTION = "connection_error";
    public static final String ERROR_API_PREFIX = "api_error_";
    public static final String ERROR_UNKNOWN = "unknown_error";

    static @NotNull String nonNullNonEmpty(@NotNull String name, @Nullable String value) {
        if (value == null || value.isEmpty())
            throw new IllegalArgumentException(name + " may not be null or empty");
        return value;
    }

    private PostHogNames() {
    }
}
