package net.hollowcube.flags;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * {@link FlagResultCache} shared between processes through Redis.
 *
 * <p>Each (distinct id, flag) pair is stored as one JSON document which expires after the stale window. There is
 * no LRU bookkeeping, Redis expiry bounds the size instead. The default prefix is kept apart from the keys of
 * {@link RedisFlagDefinitionCache} so that invalidation scans never touch them. Every Redis failure is logged and treated as a miss.</p>
 */
public final class RedisFlagResultCache implements FlagResultCache, Closeable {
    private static final Logger log = LoggerFactory.getLogger(RedisFlagResultCache.class);

    public static final String DEFAULT_PREFIX = "posthog:flag-results:";
    private static final int SCAN_BATCH_SIZE = 100;

    private final JedisPool pool;
    private final String prefix;
    private final Duration ttl;
    private final Duration staleWindow;
    private final Clock clock;

    public RedisFlagResultCache(@NotNull JedisPool pool) {
        this(pool, DEFAULT_PREFIX, DEFAULT_TTL, DEFAULT_STALE_WINDOW);
    }

    public RedisFlagResultCache(@NotNull JedisPool pool, @NotNull String prefix, @NotNull Duration ttl, @NotNull Duration staleWindow) {
        this(pool, prefix, ttl, staleWindow, Clock.systemUTC());
    }

    @VisibleForTesting
    RedisFlagResultCache(@NotNull JedisPool pool, @NotNull String prefix, @NotNull Duration ttl, @NotNull Duration staleWindow, @NotNull Clock clock) {
        if (ttl.isNegative() || staleWindow.isNegative())
            throw new IllegalArgumentException("TTL and stale window must be positive");
        this.pool = Objects.requireNonNull(pool);
        this.prefix = PostHogNames.nonNullNonEmpty("prefix", prefix);
        this.ttl = ttl;
        this.staleWindow = staleWindow;
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public @Nullable FeatureFlagState getCachedFlag(@NotNull String distinctId, @NotNull String flagKey, long currentVersion) {
        final StoredEntry entry = read(distinctId, flagKey);
        if (entry == null || entry.version() != currentVersion || !isYoungerThan(entry, ttl))
            return null;
        return entry.result();
    }

    @Override
    public @Nullable FeatureFlagState getStaleCachedFlag(@NotNull String distinctId, @NotNull String flagKey) {
        return getStaleCachedFlag(distinctId, flagKey, staleWindow);
    }

    @Override
    public @Nullable FeatureFlagState getStaleCachedFlag(@NotNull String distinctId, @NotNull String flagKey, @NotNull Duration maxStaleAge) {
        final StoredEntry entry = read(distinctId, flagKey);
        return entry != null && isYoungerThan(entry, maxStaleAge) ? entry.result() : null;
    }

    @Override
    public void setCachedFlag(@NotNull String distinctId, @NotNull String flagKey, @NotNull FeatureFlagState result, long version) {
        final JsonObject json = new JsonObject();
        json.add("flag_result", result.toJson());
        json.addProperty("flag_version", version);
        json.addProperty("timestamp", clock.millis());

        try (Jedis jedis = pool.getResource()) {
            jedis.setex(key(distinctId, flagKey), Math.max(1, staleWindow.toSeconds()), json.toString());
        } catch (RuntimeException e) {
            log.debug("failed to write flag result for '{}' to redis", flagKey, e);
        }
    }

    @Override
    public void invalidateVersion(long oldVersion) {
        try (Jedis jedis = pool.getResource()) {
            deleteMatching(jedis, entry -> entry.version() == oldVersion);
        } catch (RuntimeException e) {
            log.debug("failed to invalidate flag results of version {} in redis", oldVersion, e);
        }
    }

    /**
     * Deletes every flag result under the prefix. Other keys sharing the prefix are left alone.
     */
    @Override
    public void clear() {
        try (Jedis jedis = pool.getResource()) {
            deleteMatching(jedis, entry -> true);
        } catch (RuntimeException e) {
            log.debug("failed to clear flag results in redis", e);
        }
    }

    @Override
    public void close() {
        pool.close();
    }

    @VisibleForTesting
    @NotNull String key(@NotNull String distinctId, @NotNull String flagKey) {
        return prefix + distinctId + ":" + flagKey;
    }

    private void deleteMatching(@NotNull Jedis jedis, @NotNull Predicate<StoredEntry> predicate) {
        final ScanParams params = new ScanParams().match(prefix + "*").count(SCAN_BATCH_SIZE);
        final List<String> matching = new ArrayList<>();
        String cursor = ScanParams.SCAN_POINTER_START;
        do {
            final ScanResult<String> page = jedis.scan(cursor, params);
            for (final String key : page.getResult()) {
                final StoredEntry entry = parse(jedis.get(key));
                if (entry != null && predicate.test(entry)) matching.add(key);
            }
            cursor = page.getCursor();
        } while (!ScanParams.SCAN_POINTER_START.equals(cursor));

        if (!matching.isEmpty()) jedis.del(matching.toArray(String[]::new));
    }

    private @Nullable StoredEntry read(@NotNull String distinctId, @NotNull String flagKey) {
        try (Jedis jedis = pool.getResource()) {
            return parse(jedis.get(key(distinctId, flagKey)));
        } catch (RuntimeException e) {
            log.debug("failed to read flag result for '{}' from redis, treating as a miss", flagKey, e);
            return null;
        }
    }

    @VisibleForTesting
    static @Nullable StoredEntry parse(@Nullable String raw) {
        if (raw == null) return null;
        try {
            final JsonObject json = JsonParser.parseString(raw).getAsJsonObject();
            final FeatureFlagState result = FeatureFlagState.fromJson(json.get("flag_result"));
            if (result == null
                    || !(json.get("flag_version") instanceof JsonPrimitive version)
                    || !(json.get("timestamp") instanceof JsonPrimitive timestamp))
                return null;
            return new StoredEntry(result, version.getAsLong(), Instant.ofEpochMilli(timestamp.getAsLong()));
        } catch (RuntimeException e) {
            log.debug("ignoring malformed flag result in redis: {}", raw, e);
            return null;
        }
    }

    record StoredEntry(@NotNull FeatureFlagState result, long version, @NotNull Instant timestamp) {
    }

    private boolean isYoungerThan(@NotNull StoredEntry entry, @NotNull Duration maxAge) {
        return Duration.between(entry.timestamp(), clock.instant()).compareTo(maxAge) < 0;
    }
}
