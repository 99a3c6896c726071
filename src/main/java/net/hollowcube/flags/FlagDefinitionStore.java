package net.hollowcube.flags;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import net.hollowcube.flags.FlagDefinitionSource.FetchResult;
import net.hollowcube.flags.FlagDefinitions.Flag;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the current {@link FlagSnapshot} and replaces it on reloads and realtime updates.
 *
 * <p>Every new snapshot gets a new version and invalidates the results cached for the previous one.
 * Reloads and updates are serialized, readers never block.</p>
 */
final class FlagDefinitionStore {
    private static final Logger log = LoggerFactory.getLogger(FlagDefinitionStore.class);

    private final Gson gson;
    private final FlagDefinitionSource source;
    private final FlagDefinitionCacheProvider cacheProvider;
    private final FlagResultCache resultCache;
    private final FlagUpdateListener updateListener;

    private final AtomicReference<FlagSnapshot> snapshot = new AtomicReference<>(); // Null until first load
    private final AtomicLong versionCounter = new AtomicLong();
    private final ReentrantLock updateLock = new ReentrantLock();
    private volatile String etag = null;

    FlagDefinitionStore(
            @NotNull Gson gson,
            @NotNull FlagDefinitionSource source,
            @Nullable FlagDefinitionCacheProvider cacheProvider,
            @NotNull FlagResultCache resultCache,
            @Nullable FlagUpdateListener updateListener
    ) {
        this.gson = gson;
        this.source = source;
        this.cacheProvider = cacheProvider;
        this.resultCache = resultCache;
        this.updateListener = updateListener;
    }

    /**
     * @return the current snapshot, or null if definitions were never loaded
     */
    @Nullable FlagSnapshot current() {
        return snapshot.get();
    }

    /**
     * Loads definitions from the cache provider or the definition source.
     *
     * <p>If a cache provider is present it decides whether this process fetches. When it declines, the cached
     * definitions are used, falling back to the existing in-memory definitions, and to a fetch only if
     * nothing was ever loaded.</p>
     */
    @Blocking
    void load() {
        updateLock.lock();
        try {
            if (cacheProvider != null && !shouldFetch()) {
                try {
                    final FlagDefinitions cached = cacheProvider.getFlagDefinitions();
                    if (cached != null) {
                        install(cached);
                        return;
                    }
                    if (snapshot.get() != null) {
                        log.debug("no cached flag definitions available, keeping the existing definitions");
                        return;
                    }
                    log.debug("no cached flag definitions available and none loaded, fetching from PostHog");
                } catch (RuntimeException e) {
                    log.warn("flag definition cache provider failed to provide definitions, fetching from PostHog", e);
                }
            }

            fetch();
        } finally {
            updateLock.unlock();
        }
    }

    private boolean shouldFetch() {
        try {
            return cacheProvider.shouldFetchFlagDefinitions();
        } catch (RuntimeException e) {
            log.warn("flag definition cache provider failed to decide whether to fetch, fetching from PostHog", e);
            return true;
        }
    }

    private void fetch() {
        final FetchResult result;
        try {
            result = source.fetchDefinitions(etag);
        } catch (RequestException e) {
            if (e.getKind() == RequestException.Kind.QUOTA_LIMITED) {
                log.warn("PostHog feature flags quota limited, resetting feature flag data. "
                        + "Learn more about billing limits at https://posthog.com/docs/billing/limits-alerts");
                etag = null;
                install(FlagDefinitions.EMPTY);
            } else {
                log.error("failed to load flag definitions ({})", e.errorMarker(), e);
            }
            return;
        }

        if (result.notModified()) {
            log.debug("flag definitions not modified, keeping the existing definitions");
            if (result.etag() != null) etag = result.etag();
            return;
        }
        if (result.definitions() == null) {
            log.error("flag definition source returned no definitions");
            return;
        }

        etag = result.etag();
        install(result.definitions());

        if (cacheProvider != null) {
            try {
                cacheProvider.onFlagDefinitionsReceived(result.definitions());
            } catch (RuntimeException e) {
                log.warn("flag definition cache provider failed to store definitions, using them in memory only", e);
            }
        }
    }

    /**
     * Applies a realtime update: a {@code deleted} update removes the flag, anything else inserts or replaces it.
     *
     * @throws IllegalArgumentException if the update has no key or is not a valid flag definition
     */
    void applyFlagUpdate(@NotNull JsonObject update) {
        if (!(update.get("key") instanceof JsonPrimitive keyElement) || keyElement.getAsString().isEmpty())
            throw new IllegalArgumentException("flag update is missing a key");
        final String key = keyElement.getAsString();
        final boolean deleted = update.get("deleted") instanceof JsonPrimitive p && p.isBoolean() && p.getAsBoolean();

        final Flag flag;
        try {
            flag = deleted ? null : gson.fromJson(update, Flag.class);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("invalid flag update for '" + key + "'", e);
        }

        updateLock.lock();
        try {
            final FlagSnapshot previous = snapshot.get();
            final FlagSnapshot base = previous != null ? previous
                    : FlagSnapshot.build(gson, FlagDefinitions.EMPTY, versionCounter.get());
            final long version = versionCounter.incrementAndGet();
            publish(previous, flag == null ? base.withoutFlag(key, version) : base.withFlag(flag, version));
        } finally {
            updateLock.unlock();
        }
        log.debug("applied realtime update to flag '{}'{}", key, deleted ? " (deleted)" : "");

        if (updateListener != null) {
            try {
                updateListener.onFlagUpdated(key, update);
            } catch (RuntimeException e) {
                log.warn("flag update listener failed for '{}'", key, e);
            }
        }
    }

    /**
     * Releases the cache provider. Safe to call repeatedly, the provider is asked to shut down every time.
     */
    void shutdown() {
        if (cacheProvider == null) return;
        try {
            cacheProvider.shutdown();
        } catch (RuntimeException e) {
            log.warn("flag definition cache provider failed to shut down", e);
        }
    }

    // Must hold updateLock
    private void install(@NotNull FlagDefinitions definitions) {
        final FlagSnapshot next = FlagSnapshot.build(gson, definitions, versionCounter.incrementAndGet());
        publish(snapshot.get(), next);
        log.debug("loaded {} flag definitions (version {})", next.flagsByKey().size(), next.version());
    }

    private void publish(@Nullable FlagSnapshot previous, @NotNull FlagSnapshot next) {
        snapshot.set(next);
        if (previous != null) resultCache.invalidateVersion(previous.version());
    }
}
