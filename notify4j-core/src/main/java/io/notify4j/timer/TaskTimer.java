package io.notify4j.timer;

import java.time.Clock;
import java.time.Instant;

/**
 * One-shot timer primitive: runs a task once at (or shortly after) an absolute instant.
 * Recurring behaviour is built on top by rescheduling from inside the task.
 */
public interface TaskTimer extends AutoCloseable {

    TimerHandle schedule(Instant fireAt, Runnable task);

    /**
     * Clock the timer measures {@code fireAt} against.
     */
    Clock clock();

    /**
     * Cancel everything still pending and release threads.
     */
    @Override
    void close();
}
