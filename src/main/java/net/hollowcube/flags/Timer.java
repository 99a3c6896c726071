package net.hollowcube.flags;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.concurrent.locks.LockSupport;

/**
 * Runs a task repeatedly on a daemon thread, parking between runs. The first run happens immediately.
 */
final class Timer {
    private final Runnable task;
    private final long intervalNs;

    private final Thread taskThread;
    private volatile boolean closed = false;

    public Timer(@NotNull String name, @NotNull Runnable task, @NotNull Duration interval) {
        this.task = task;
        this.intervalNs = interval.toNanos();

        this.taskThread = new Thread(this::runLoop, name);
        this.taskThread.setDaemon(true);
        this.taskThread.start();
    }

    /**
     * Stops the timer. Closing an already closed timer does nothing.
     */
    public void close() {
        if (closed) return;

        closed = true;
        LockSupport.unpark(taskThread);
        // Don't care about joining it should not complete any work.
    }

    private void runLoop() {
        while (!closed) {
            task.run();

            if (!closed) LockSupport.parkNanos(intervalNs);
        }
    }
}
