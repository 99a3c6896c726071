package net.hollowcube.flags;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process {@link FlagResultCache} bounded by the number of distinct ids it tracks.
 *
 * <p>Reads never take a lock. Writes, eviction and invalidation are serialized. When a new distinct id would
 * exceed the size bound, the least recently used fifth of the distinct ids is evicted first.</p>
 */
public final class LocalFlagResultCache implements FlagResultCache {

    private record Entry(@NotNull FeatureFlagState result, long version, @NotNull Instant timestamp) {
    }

    private static final class UserEntries {
        private final Map<String, Entry> flags = new ConcurrentHashMap<>();
        private volatile long lastAccess;
    }

    private final Map<String, UserEntries> users = new ConcurrentHashMap<>();
    private final AtomicLong accessCounter = new AtomicLong();
    private final ReentrantLock writeLock = new ReentrantLock();

    private final int maxSize;
    private final Duration ttl;
    private final Duration staleWindow;
    private final Clock clock;

    public LocalFlagResultCache() {
        this(DEFAULT_MAX_SIZE, DEFAULT_TTL, DEFAULT_STALE_WINDOW);
    }

    public LocalFlagResultCache(int maxSize, @NotNull Duration ttl, @NotNull Duration staleWindow) {
        this(maxSize, ttl, staleWindow, Clock.systemUTC());
    }

    @VisibleForTesting
    LocalFlagResultCache(int maxSize, @NotNull Duration ttl, @NotNull Duration staleWindow, @NotNull Clock clock) {
        if (maxSize <= 0)
            throw new IllegalArgumentException("Max size must be positive");
        if (ttl.isNegative() || staleWindow.isNegative())
            throw new IllegalArgumentException("TTL and stale window must be positive");
        this.maxSize = maxSize;
        this.ttl = ttl;
        this.staleWindow = staleWindow;
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public @Nullable FeatureFlagState getCachedFlag(@NotNull String distinctId, @NotNull String flagKey, long currentVersion) {
        final UserEntries user = users.get(distinctId);
        if (user == null) return null;
        final Entry entry = user.flags.get(flagKey);
        if (entry == null || entry.version() != currentVersion || !isYoungerThan(entry, ttl))
            return null;

        user.lastAccess = accessCounter.incrementAndGet();
        return entry.result();
    }

    @Override
    public @Nullable FeatureFlagState getStaleCachedFlag(@NotNull String distinctId, @NotNull String flagKey) {
        return getStaleCachedFlag(distinctId, flagKey, staleWindow);
    }

    @Override
    public @Nullable FeatureFlagState getStaleCachedFlag(@NotNull String distinctId, @NotNull String flagKey, @NotNull Duration maxStaleAge) {
        final UserEntries user = users.get(distinctId);
        if (user == null) return null;
        final Entry entry = user.flags.get(flagKey);
        return entry != null && isYoungerThan(entry, maxStaleAge) ? entry.result() : null;
    }

    @Override
    public void setCachedFlag(@NotNull String distinctId, @NotNull String flagKey, @NotNull FeatureFlagState result, long version) {
        writeLock.lock();
        try {
            UserEntries user = users.get(distinctId);
            if (user == null) {
                if (users.size() >= maxSize) evictLeastRecentlyUsed();
                user = new UserEntries();
                users.put(distinctId, user);
            }
            user.flags.put(flagKey, new Entry(result, version, clock.instant()));
            user.lastAccess = accessCounter.incrementAndGet();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void invalidateVersion(long oldVersion) {
        writeLock.lock();
        try {
            for (final UserEntries user : users.values())
                user.flags.values().removeIf(entry -> entry.version() == oldVersion);
            users.values().removeIf(user -> user.flags.isEmpty());
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void clear() {
        writeLock.lock();
        try {
            users.clear();
        } finally {
            writeLock.unlock();
        }
    }

    @VisibleForTesting
    int size() {
        return users.size();
    }

    @VisibleForTesting
    boolean containsUser(@NotNull String distinctId) {
        return users.containsKey(distinctId);
    }

    private record AccessSnapshot(@NotNull String distinctId, long lastAccess) {
    }

    // Must hold writeLock. Reads keep bumping lastAccess, so sort a frozen copy of it.
    private void evictLeastRecentlyUsed() {
        final List<AccessSnapshot> byAccess = new ArrayList<>(users.size());
        for (final Map.Entry<String, UserEntries> entry : users.entrySet())
            byAccess.add(new AccessSnapshot(entry.getKey(), entry.getValue().lastAccess));
        byAccess.sort(Comparator.comparingLong(AccessSnapshot::lastAccess));

        final int toEvict = Math.max(1, byAccess.size() / 5);
        for (int i = 0; i < toEvict && i < byAccess.size(); i++)
            users.remove(byAccess.get(i).distinctId());
    }

    private boolean isYoungerThan(@NotNull Entry entry, @NotNull Duration maxAge) {
        return Duration.between(entry.timestamp(), clock.instant()).compareTo(maxAge) < 0;
    }
}
