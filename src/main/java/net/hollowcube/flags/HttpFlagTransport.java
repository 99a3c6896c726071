package net.hollowcube.flags;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import static net.hollowcube.flags.PostHogNames.nonNullNonEmpty;

/**
 * Minimal HTTP implementation of {@link FlagDefinitionSource} and {@link RemoteEvaluator} against the PostHog API.
 *
 * <p>There is no retry, every failure is reported as a classified {@link RequestException}.</p>
 */
public final class HttpFlagTransport implements FlagDefinitionSource, RemoteEvaluator {
    private static final String DEFAULT_LIBRARY_NAME = "github.com/hollow-cube/posthog-flags";
    private static final String DEFAULT_LIBRARY_VERSION = "1.0.0";
    private static final String USER_AGENT = String.format("%s/%s", DEFAULT_LIBRARY_NAME, DEFAULT_LIBRARY_VERSION);

    private static final int STATUS_NOT_MODIFIED = 304;
    private static final int STATUS_PAYMENT_REQUIRED = 402;
    private static final String QUOTA_LIMITED_RESOURCE = "feature_flags";

    private final HttpClient httpClient;
    private final Gson gson;

    private final String endpoint;
    private final String projectApiKey;
    private final String personalApiKey;
    private final Duration requestTimeout;

    /**
     * @param personalApiKey required to fetch flag definitions, may be null if only remote evaluation is used
     */
    public HttpFlagTransport(
            @NotNull Gson gson, @NotNull String endpoint, @NotNull String projectApiKey,
            @Nullable String personalApiKey, @NotNull Duration requestTimeout
    ) {
        this.gson = Objects.requireNonNull(gson);
        this.endpoint = nonNullNonEmpty("endpoint", endpoint);
        this.projectApiKey = nonNullNonEmpty("projectApiKey", projectApiKey);
        this.personalApiKey = personalApiKey;
        if (requestTimeout.isNegative() || requestTimeout.isZero())
            throw new IllegalArgumentException("Request timeout must be positive");
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder().connectTimeout(requestTimeout).build();
    }

    public boolean supportsLocalEvaluation() {
        return personalApiKey != null;
    }

    @Blocking
    @Override
    public @NotNull FetchResult fetchDefinitions(@Nullable String etag) throws RequestException {
        if (personalApiKey == null)
            throw new IllegalStateException("A personal API key is required to fetch flag definitions");

        final String url = String.format("%s/api/feature_flag/local_evaluation?token=%s&send_cohorts",
                endpoint, URLEncoder.encode(projectApiKey, StandardCharsets.UTF_8));
        final HttpRequest.Builder req = HttpRequest.newBuilder(URI.create(url))
                .header("Authorization", String.format("Bearer %s", personalApiKey))
                .header("User-Agent", USER_AGENT)
                .timeout(requestTimeout);
        if (etag != null) req.header("If-None-Match", etag);

        final HttpResponse<String> res = send(req.build(), "/api/feature_flag/local_evaluation");
        final String newEtag = res.headers().firstValue("ETag").orElse(etag);
        if (res.statusCode() == STATUS_NOT_MODIFIED)
            return FetchResult.notModified(newEtag);
        if (res.statusCode() == STATUS_PAYMENT_REQUIRED)
            throw new RequestException(RequestException.Kind.QUOTA_LIMITED, STATUS_PAYMENT_REQUIRED,
                    "feature flags quota limited", null);
        if (res.statusCode() != 200)
            throw RequestException.apiError(res.statusCode(), String.format(
                    "unexpected response from /api/feature_flag/local_evaluation (%d): %s", res.statusCode(), res.body()));

        try {
            final FlagDefinitions definitions = gson.fromJson(res.body(), FlagDefinitions.class);
            if (definitions == null) throw new JsonParseException("empty response body");
            return FetchResult.of(definitions, newEtag);
        } catch (JsonParseException e) {
            throw new RequestException(RequestException.Kind.API_ERROR, res.statusCode(),
                    "malformed response from /api/feature_flag/local_evaluation", e);
        }
    }

    @Blocking
    @Override
    public @NotNull RemoteEvaluation evaluate(@NotNull String distinctId, @NotNull FeatureFlagContext context) throws RequestException {
        final HashMap<String, Object> body = new HashMap<>();
        body.put("api_key", this.projectApiKey);
        body.put("distinct_id", nonNullNonEmpty("distinctId", distinctId));
        if (context.groups() != null) body.put("groups", context.groups());
        if (context.personProperties() != null) body.put("person_properties", context.personProperties());
        if (context.groupProperties() != null) body.put("group_properties", context.groupProperties());

        final HttpRequest req = HttpRequest.newBuilder(URI.create(String.format("%s/decide?v=3", endpoint)))
                .POST(HttpRequest.BodyPublishers.ofString(this.gson.toJson(body)))
                .header("Content-Type", "application/json; charset=utf-8")
                .header("User-Agent", USER_AGENT)
                .timeout(requestTimeout)
                .build();
        final HttpResponse<String> res = send(req, "/decide");
        if (res.statusCode() != 200)
            throw RequestException.apiError(res.statusCode(), String.format(
                    "unexpected response from /decide (%d): %s", res.statusCode(), res.body()));

        final JsonObject response;
        try {
            response = gson.fromJson(res.body(), JsonObject.class);
        } catch (JsonParseException e) {
            throw new RequestException(RequestException.Kind.API_ERROR, res.statusCode(), "malformed response from /decide", e);
        }
        if (response == null)
            throw new RequestException(RequestException.Kind.API_ERROR, res.statusCode(), "empty response from /decide", null);
        return parseDecideResponse(response);
    }

    static @NotNull RemoteEvaluation parseDecideResponse(@NotNull JsonObject response) throws RequestException {
        if (response.get("quotaLimited") instanceof JsonArray limited && limited.contains(new JsonPrimitive(QUOTA_LIMITED_RESOURCE)))
            throw new RequestException(RequestException.Kind.QUOTA_LIMITED, "feature flags quota limited");

        final JsonObject featureFlags = response.get("featureFlags") instanceof JsonObject o ? o : new JsonObject();
        final JsonObject featureFlagPayloads = response.get("featureFlagPayloads") instanceof JsonObject o ? o : new JsonObject();
        final Map<String, FeatureFlagState> states = new HashMap<>();
        for (final String key : featureFlags.keySet())
            states.put(key, new FeatureFlagState(featureFlags, featureFlagPayloads, key));

        final JsonElement errors = response.get("errorsWhileComputingFlags");
        final JsonElement requestId = response.get("requestId");
        return new RemoteEvaluation(states,
                errors instanceof JsonPrimitive p && p.isBoolean() && p.getAsBoolean(),
                requestId instanceof JsonPrimitive p ? p.getAsString() : null);
    }

    private @NotNull HttpResponse<String> send(@NotNull HttpRequest req, @NotNull String name) throws RequestException {
        try {
            return this.httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpConnectTimeoutException e) {
            throw new RequestException(RequestException.Kind.CONNECTION, "timed out connecting for " + name + " request", e);
        } catch (HttpTimeoutException e) {
            throw new RequestException(RequestException.Kind.TIMEOUT, "timed out making " + name + " request", e);
        } catch (IOException e) {
            throw new RequestException(RequestException.Kind.CONNECTION, "failed to make " + name + " request", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestException(RequestException.Kind.CONNECTION, name + " request was interrupted", e);
        }
    }
}
