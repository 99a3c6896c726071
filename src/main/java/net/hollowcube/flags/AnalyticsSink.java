package net.hollowcube.flags;

import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * Receives analytics events produced by flag evaluation. Must not block.
 */
@FunctionalInterface
public interface AnalyticsSink {

    void sendEvent(@NotNull String event, @NotNull String distinctId, @NotNull Map<String, Object> properties, @NotNull Map<String, String> groups);
}
