package net.hollowcube.flags;

import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Pull based source of flag definitions, typically the local evaluation endpoint.
 */
@FunctionalInterface
public interface FlagDefinitionSource {

    /**
     * The outcome of a fetch.
     *
     * @param definitions the new definitions, null if and only if {@code notModified}
     * @param etag        the entity tag to send with the next fetch, if the source supports it
     */
    record FetchResult(@Nullable FlagDefinitions definitions, @Nullable String etag, boolean notModified) {

        public static @NotNull FetchResult of(@NotNull FlagDefinitions definitions, @Nullable String etag) {
            return new FetchResult(definitions, etag, false);
        }

        public static @NotNull FetchResult notModified(@Nullable String etag) {
            return new FetchResult(null, etag, true);
        }
    }

    /**
     * @param etag the entity tag of the last successful fetch, or null
     * @throws RequestException if the definitions could not be fetched
     */
    @Blocking
    @NotNull FetchResult fetchDefinitions(@Nullable String etag) throws RequestException;
}
