package net.hollowcube.flags;

import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Evaluates flags on the PostHog server, used when local evaluation is not possible.
 */
@FunctionalInterface
public interface RemoteEvaluator {

    /**
     * @param states                    every flag the server returned
     * @param errorsWhileComputingFlags true if the server could not compute some flags
     * @param requestId                 the server's id of this request, if provided
     */
    record RemoteEvaluation(
            @NotNull Map<String, FeatureFlagState> states,
            boolean errorsWhileComputingFlags,
            @Nullable String requestId
    ) {
        public RemoteEvaluation {
            states = Map.copyOf(states);
        }
    }

    @Blocking
    @NotNull RemoteEvaluation evaluate(@NotNull String distinctId, @NotNull FeatureFlagContext context) throws RequestException;
}
