package net.hollowcube.flags;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Coordinates flag definition fetching between several processes, for example so that only one instance
 * polls PostHog while the others read the shared result.
 *
 * <p>Every hook may fail. Failures are logged and never stop evaluation:</p>
 * <ul>
 *     <li>{@link #shouldFetchFlagDefinitions()} failing means "fetch"</li>
 *     <li>{@link #getFlagDefinitions()} failing falls through to a fetch</li>
 *     <li>{@link #onFlagDefinitionsReceived(FlagDefinitions)} failing keeps the fetched definitions in memory</li>
 *     <li>{@link #shutdown()} failing does not stop shutdown</li>
 * </ul>
 */
public interface FlagDefinitionCacheProvider {

    /**
     * @return true if this process should fetch definitions from PostHog, false to read them from the cache
     */
    boolean shouldFetchFlagDefinitions();

    /**
     * @return the cached definitions, or null if there are none
     */
    @Nullable FlagDefinitions getFlagDefinitions();

    /**
     * Called with freshly fetched definitions, typically to share them with other processes.
     */
    void onFlagDefinitionsReceived(@NotNull FlagDefinitions definitions);

    /**
     * Releases any resources (or leadership) held by this provider. May be called more than once.
     */
    void shutdown();
}
