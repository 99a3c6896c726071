package net.hollowcube.flags;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import net.hollowcube.flags.FlagDefinitionSource.FetchResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static net.hollowcube.flags.DependencyGraphTest.flag;
import static org.junit.jupiter.api.Assertions.*;

class FlagDefinitionStoreTest {
    private static final Gson GSON = new GsonBuilder().disableJdkUnsafe().create();

    private static final FlagDefinitions ONE_FLAG = new FlagDefinitions(List.of(flag(1, "a")), Map.of(), Map.of());
    private static final String FLAG_B = "{\"id\":2,\"key\":\"b\",\"active\":true,\"filters\":{\"groups\":[{\"properties\":[],\"rollout_percentage\":100}]}}";
    private static final FlagDefinitions TWO_FLAGS = new FlagDefinitions(List.of(flag(1, "a"), flag(2, "b")), Map.of(), Map.of());

    private final FakeSource source = new FakeSource();
    private final LocalFlagResultCache resultCache = new LocalFlagResultCache();

    @Test
    void nothingBeforeLoad() {
        assertNull(newStore(null, null).current());
    }

    @Test
    void loadInstallsDefinitions() {
        source.respond(FetchResult.of(ONE_FLAG, "etag-1"));
        var store = newStore(null, null);
        store.load();

        var snapshot = store.current();
        assertNotNull(snapshot);
        assertEquals(1, snapshot.version());
        assertNotNull(snapshot.flag("a"));
    }

    @Test
    void etagSentBackAndNotModifiedKeepsSnapshot() {
        source.respond(FetchResult.of(ONE_FLAG, "etag-1"));
        source.respond(FetchResult.notModified("etag-1"));
        var store = newStore(null, null);
        store.load();
        var first = store.current();

        store.load();
        assertSame(first, store.current());
        assertEquals(List.of("<none>", "etag-1"), source.etags);
    }

    @Test
    void reloadBumpsVersionAndInvalidatesResults() {
        source.respond(FetchResult.of(ONE_FLAG, null));
        source.respond(FetchResult.of(TWO_FLAGS, null));
        var store = newStore(null, null);
        store.load();
        resultCache.setCachedFlag("user", "a", FeatureFlagState.ENABLED, 1);

        store.load();
        assertEquals(2, store.current().version());
        assertNull(resultCache.getStaleCachedFlag("user", "a"));
    }

    @Test
    void failedFetchKeepsDefinitions() {
        source.respond(FetchResult.of(ONE_FLAG, null));
        source.fail(new RequestException(RequestException.Kind.TIMEOUT, "timed out"));
        var store = newStore(null, null);
        store.load();
        var first = store.current();

        store.load();
        assertSame(first, store.current());
    }

    @Test
    void quotaLimitedClearsDefinitions() {
        source.respond(FetchResult.of(ONE_FLAG, null));
        source.fail(new RequestException(RequestException.Kind.QUOTA_LIMITED, 402, "quota limited", null));
        var store = newStore(null, null);
        store.load();

        store.load();
        assertTrue(store.current().isEmpty());
        assertEquals(2, store.current().version());
    }

    @Nested
    class CacheProvider {
        private final FakeProvider provider = new FakeProvider();

        @Test
        void leaderFetchesAndStores() {
            source.respond(FetchResult.of(ONE_FLAG, null));
            var store = newStore(provider, null);
            store.load();

            assertEquals(1, source.calls);
            assertEquals(List.of(ONE_FLAG), provider.received);
        }

        @Test
        void followerReadsCache() {
            provider.shouldFetch = false;
            provider.cached = TWO_FLAGS;
            var store = newStore(provider, null);
            store.load();

            assertEquals(0, source.calls);
            assertNotNull(store.current().flag("b"));
            assertTrue(provider.received.isEmpty());
        }

        @Test
        void emptyCacheWithoutFlagsFetches() {
            provider.shouldFetch = false;
            source.respond(FetchResult.of(ONE_FLAG, null));
            var store = newStore(provider, null);
            store.load();

            assertEquals(1, source.calls);
            assertNotNull(store.current().flag("a"));
        }

        @Test
        void emptyCacheKeepsExistingFlags() {
            source.respond(FetchResult.of(ONE_FLAG, null));
            var store = newStore(provider, null);
            store.load();
            var first = store.current();

            provider.shouldFetch = false;
            store.load();
            assertSame(first, store.current());
            assertEquals(1, source.calls);
        }

        @Test
        void failingDecisionFetches() {
            provider.failShouldFetch = true;
            source.respond(FetchResult.of(ONE_FLAG, null));
            var store = newStore(provider, null);
            store.load();

            assertEquals(1, source.calls);
        }

        @Test
        void failingCacheReadFetches() {
            provider.shouldFetch = false;
            provider.failGet = true;
            source.respond(FetchResult.of(ONE_FLAG, null));
            var store = newStore(provider, null);
            store.load();

            assertEquals(1, source.calls);
            assertNotNull(store.current().flag("a"));
        }

        @Test
        void failingStoreKeepsFetchedFlags() {
            provider.failReceived = true;
            source.respond(FetchResult.of(ONE_FLAG, null));
            var store = newStore(provider, null);
            store.load();

            assertNotNull(store.current().flag("a"));
        }

        @Test
        void notModifiedSkipsStore() {
            source.respond(FetchResult.notModified(null));
            var store = newStore(provider, null);
            store.load();

            assertTrue(provider.received.isEmpty());
            assertNull(store.current());
        }

        @Test
        void shutdownAlwaysForwarded() {
            var store = newStore(provider, null);
            store.shutdown();
            provider.failShutdown = true;
            store.shutdown();
            assertEquals(2, provider.shutdowns);
        }
    }

    @Nested
    class RealtimeUpdates {

        @Test
        void upsertAddsFlag() {
            source.respond(FetchResult.of(ONE_FLAG, null));
            var updates = new ArrayList<String>();
            var store = newStore(null, (key, data) -> updates.add(key));
            store.load();
            resultCache.setCachedFlag("user", "a", FeatureFlagState.ENABLED, 1);

            store.applyFlagUpdate(GSON.fromJson(FLAG_B, JsonObject.class));
            var snapshot = store.current();
            assertEquals(2, snapshot.version());
            assertNotNull(snapshot.flag("a"));
            assertNotNull(snapshot.flag("b"));
            assertNull(resultCache.getStaleCachedFlag("user", "a"));
            assertEquals(List.of("b"), updates);
        }

        @Test
        void upsertReplacesFlag() {
            source.respond(FetchResult.of(ONE_FLAG, null));
            var store = newStore(null, null);
            store.load();

            var update = GSON.fromJson("{\"id\":1,\"key\":\"a\",\"active\":false,\"filters\":{\"groups\":[]}}", JsonObject.class);
            store.applyFlagUpdate(update);
            assertFalse(store.current().flag("a").active());
            assertEquals(1, store.current().flagsByKey().size());
        }

        @Test
        void deleteRemovesFlag() {
            source.respond(FetchResult.of(TWO_FLAGS, null));
            var store = newStore(null, null);
            store.load();

            store.applyFlagUpdate(GSON.fromJson("{\"key\":\"a\",\"deleted\":true}", JsonObject.class));
            assertNull(store.current().flag("a"));
            assertNotNull(store.current().flag("b"));
            assertEquals(2, store.current().version());
        }

        @Test
        void updateBeforeLoad() {
            var store = newStore(null, null);
            store.applyFlagUpdate(GSON.fromJson(FLAG_B, JsonObject.class));
            assertNotNull(store.current().flag("b"));
        }

        @Test
        void listenerFailureIgnored() {
            var store = newStore(null, (key, data) -> {
                throw new IllegalStateException("listener failed");
            });
            assertDoesNotThrow(() -> store.applyFlagUpdate(GSON.fromJson(FLAG_B, JsonObject.class)));
            assertNotNull(store.current().flag("b"));
        }

        @Test
        void invalidUpdatesRejected() {
            var store = newStore(null, null);
            assertThrows(IllegalArgumentException.class, () -> store.applyFlagUpdate(new JsonObject()));
            assertThrows(IllegalArgumentException.class, () -> store.applyFlagUpdate(
                    GSON.fromJson("{\"key\":\"a\",\"filters\":{\"groups\":[{\"properties\":[{\"type\":\"person\"}]}]}}", JsonObject.class)));
            assertNull(store.current());
        }
    }

    private @NotNull FlagDefinitionStore newStore(@Nullable FlagDefinitionCacheProvider provider, @Nullable FlagUpdateListener listener) {
        return new FlagDefinitionStore(GSON, source, provider, resultCache, listener);
    }

    static final class FakeSource implements FlagDefinitionSource {
        private final Deque<Object> responses = new ArrayDeque<>();
        final List<String> etags = new ArrayList<>();
        int calls = 0;

        void respond(@NotNull FetchResult result) {
            responses.add(result);
        }

        void fail(@NotNull RequestException e) {
            responses.add(e);
        }

        @Override
        public @NotNull FetchResult fetchDefinitions(@Nullable String etag) throws RequestException {
            calls++;
            etags.add(etag == null ? "<none>" : etag);
            final Object next = responses.poll();
            if (next == null) throw new RequestException(RequestException.Kind.CONNECTION, "no response queued");
            if (next instanceof RequestException e) throw e;
            return (FetchResult) next;
        }
    }

    static final class FakeProvider implements FlagDefinitionCacheProvider {
        boolean shouldFetch = true;
        FlagDefinitions cached = null;
        boolean failShouldFetch, failGet, failReceived, failShutdown;
        final List<FlagDefinitions> received = new ArrayList<>();
        int shutdowns = 0;

        @Override
        public boolean shouldFetchFlagDefinitions() {
            if (failShouldFetch) throw new IllegalStateException("redis down");
            return shouldFetch;
        }

        @Override
        public @Nullable FlagDefinitions getFlagDefinitions() {
            if (failGet) throw new IllegalStateException("redis down");
            return cached;
        }

        @Override
        public void onFlagDefinitionsReceived(@NotNull FlagDefinitions definitions) {
            if (failReceived) throw new IllegalStateException("redis down");
            received.add(definitions);
        }

        @Override
        public void shutdown() {
            shutdowns++;
            if (failShutdown) throw new IllegalStateException("redis down");
        }
    }
}
