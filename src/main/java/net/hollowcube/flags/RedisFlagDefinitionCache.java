package net.hollowcube.flags;

import com.google.gson.Gson;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * {@link FlagDefinitionCacheProvider} which elects a single leader among all processes sharing a Redis instance.
 *
 * <p>The leader fetches definitions from PostHog and publishes them, every other instance reads the published
 * copy. Leadership is a lock with a TTL which the leader renews on every poll, so if the leader dies another
 * instance takes over once the lock expires.</p>
 *
 * <p>Redis keys: {@code posthog:flags:<service>} holds the definitions and {@code posthog:flags:<service>:lock}
 * the leader lock.</p>
 */
public final class RedisFlagDefinitionCache implements FlagDefinitionCacheProvider {
    private static final Logger log = LoggerFactory.getLogger(RedisFlagDefinitionCache.class);

    static final String KEY_PREFIX = "posthog:flags:";

    // Should be longer than the polling interval
    static final Duration LOCK_TTL = Duration.ofSeconds(60);
    static final Duration CACHE_TTL = Duration.ofHours(24);

    private static final String TRY_LEAD_SCRIPT = """
            local current = redis.call('GET', KEYS[1])
            if current == false then
                redis.call('SET', KEYS[1], ARGV[1], 'PX', ARGV[2])
                return 1
            elseif current == ARGV[1] then
                redis.call('PEXPIRE', KEYS[1], ARGV[2])
                return 1
            end
            return 0
            """;
    private static final String STOP_LEAD_SCRIPT = """
            if redis.call('GET', KEYS[1]) == ARGV[1] then
                return redis.call('DEL', KEYS[1])
            end
            return 0
            """;

    private final JedisPool pool;
    private final Gson gson;
    private final String cacheKey;
    private final String lockKey;
    private final String instanceId = UUID.randomUUID().toString();

    /**
     * @param serviceKey unique name of this service or environment, scopes the Redis keys
     */
    public RedisFlagDefinitionCache(@NotNull JedisPool pool, @NotNull String serviceKey) {
        this(pool, serviceKey, new Gson());
    }

    public RedisFlagDefinitionCache(@NotNull JedisPool pool, @NotNull String serviceKey, @NotNull Gson gson) {
        this.pool = Objects.requireNonNull(pool);
        this.gson = Objects.requireNonNull(gson);
        this.cacheKey = KEY_PREFIX + PostHogNames.nonNullNonEmpty("serviceKey", serviceKey);
        this.lockKey = this.cacheKey + ":lock";
    }

    @Override
    public boolean shouldFetchFlagDefinitions() {
        try (Jedis jedis = pool.getResource()) {
            final Object result = jedis.eval(TRY_LEAD_SCRIPT, List.of(lockKey), List.of(instanceId, String.valueOf(LOCK_TTL.toMillis())));
            return result instanceof Long l && l == 1L;
        }
    }

    @Override
    public @Nullable FlagDefinitions getFlagDefinitions() {
        try (Jedis jedis = pool.getResource()) {
            final String cached = jedis.get(cacheKey);
            return cached == null ? null : gson.fromJson(cached, FlagDefinitions.class);
        }
    }

    @Override
    public void onFlagDefinitionsReceived(@NotNull FlagDefinitions definitions) {
        try (Jedis jedis = pool.getResource()) {
            jedis.setex(cacheKey, CACHE_TTL.toSeconds(), gson.toJson(definitions));
        }
    }

    @Override
    public void shutdown() {
        try (Jedis jedis = pool.getResource()) {
            jedis.eval(STOP_LEAD_SCRIPT, List.of(lockKey), List.of(instanceId));
        }
        log.debug("released flag definition leadership for {}", cacheKey);
    }
}
