package io.notify4j.timer;

/**
 * Handle of a task registered with a {@link TaskTimer}.
 */
public interface TimerHandle {

    /**
     * Prevent the task from running if it has not started yet. A task that is already running is not interrupted.
     */
    void cancel();

    boolean isCancelled();
}
