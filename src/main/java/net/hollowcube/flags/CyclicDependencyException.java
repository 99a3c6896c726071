package net.hollowcube.flags;

import org.jetbrains.annotations.NotNull;

public final class CyclicDependencyException extends DependencyGraphException {
    private final String flagKey;

    public CyclicDependencyException(@NotNull String flagKey) {
        super("Cyclic dependency detected for flag: " + flagKey);
        this.flagKey = flagKey;
    }

    /**
     * @return one of the flags which could not be ordered
     */
    public @NotNull String getFlagKey() {
        return flagKey;
    }
}
