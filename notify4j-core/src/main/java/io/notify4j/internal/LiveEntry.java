package io.notify4j.internal;

import io.notify4j.timer.TimerHandle;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registry value: the live timer of one schedule (or one system task).
 *
 * <p>Mutable state is only touched while holding the scheduler's registry lock,
 * except {@link #tryBeginRun()}/{@link #endRun()} which guard overlapping ticks.
 */
final class LiveEntry {

    enum Kind {
        RECURRING,
        ONE_SHOT
    }

    private final String key;
    private final String label;
    private final Kind kind;
    private final String cron;
    private final Runnable action;

    private TimerHandle handle;
    private Instant nextFireAt;
    private boolean cancelled;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private LiveEntry(String key, String label, Kind kind, String cron, Runnable action) {
        this.key = key;
        this.label = label;
        this.kind = kind;
        this.cron = cron;
        this.action = action;
    }

    static LiveEntry recurring(String key, String label, String cron, Runnable action) {
        return new LiveEntry(key, label, Kind.RECURRING, cron, action);
    }

    static LiveEntry oneShot(String key, String label, Runnable action) {
        return new LiveEntry(key, label, Kind.ONE_SHOT, null, action);
    }

    String key() {
        return key;
    }

    String label() {
        return label;
    }

    Kind kind() {
        return kind;
    }

    String cron() {
        return cron;
    }

    Runnable action() {
        return action;
    }

    Instant nextFireAt() {
        return nextFireAt;
    }

    void arm(TimerHandle handle, Instant fireAt) {
        this.handle = handle;
        this.nextFireAt = fireAt;
    }

    boolean isCancelled() {
        return cancelled;
    }

    void cancel() {
        cancelled = true;
        if (handle != null) {
            handle.cancel();
        }
    }

    boolean tryBeginRun() {
        return running.compareAndSet(false, true);
    }

    void endRun() {
        running.set(false);
    }
}
