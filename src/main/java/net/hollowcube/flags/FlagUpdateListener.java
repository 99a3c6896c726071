package net.hollowcube.flags;

import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;

/**
 * Notified after a realtime flag update has been applied.
 */
@FunctionalInterface
public interface FlagUpdateListener {

    /**
     * @param flagKey  the key of the updated (or deleted) flag
     * @param flagData the raw update as received
     */
    void onFlagUpdated(@NotNull String flagKey, @NotNull JsonObject flagData);
}
