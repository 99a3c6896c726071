package net.hollowcube.flags;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;

/**
 * Per (distinct id, flag) cache of resolved flag states.
 *
 * <p>Entries are fresh while younger than the TTL and stored for the current flag definition version. Older
 * entries remain usable as a degraded fallback (see {@link #getStaleCachedFlag(String, String)}) until they leave
 * the stale window.</p>
 *
 * <p>Implementations must be thread safe and must never throw because of a failing backend. A backend
 * failure is a cache miss.</p>
 */
public interface FlagResultCache {
    int DEFAULT_MAX_SIZE = 10_000;
    Duration DEFAULT_TTL = Duration.ofMinutes(5);
    Duration DEFAULT_STALE_WINDOW = Duration.ofHours(1);

    /**
     * @return the cached state if it is younger than the TTL and was stored for {@code currentVersion}, null otherwise
     */
    @Nullable FeatureFlagState getCachedFlag(@NotNull String distinctId, @NotNull String flagKey, long currentVersion);

    /**
     * Looks up a result regardless of the definition version it was stored for, bounded by the stale window.
     * Only to be used after the primary path failed.
     */
    @Nullable FeatureFlagState getStaleCachedFlag(@NotNull String distinctId, @NotNull String flagKey);

    @Nullable FeatureFlagState getStaleCachedFlag(@NotNull String distinctId, @NotNull String flagKey, @NotNull Duration maxStaleAge);

    void setCachedFlag(@NotNull String distinctId, @NotNull String flagKey, @NotNull FeatureFlagState result, long version);

    /**
     * Removes every entry which was stored for the given definition version.
     */
    void invalidateVersion(long oldVersion);

    void clear();
}
