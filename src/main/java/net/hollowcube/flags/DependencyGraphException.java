package net.hollowcube.flags;

import org.jetbrains.annotations.NotNull;

public class DependencyGraphException extends Exception {

    public DependencyGraphException(@NotNull String message) {
        super(message);
    }
}
