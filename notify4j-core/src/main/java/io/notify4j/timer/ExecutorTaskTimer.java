package io.notify4j.timer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TaskTimer} backed by a {@link ScheduledThreadPoolExecutor} (a delay heap ordered by fire time).
 */
public class ExecutorTaskTimer implements TaskTimer {
    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskTimer.class);

    private final Clock clock;
    private final ScheduledThreadPoolExecutor executor;

    public ExecutorTaskTimer(Clock clock, int threads) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be a positive number");
        }

        AtomicInteger counter = new AtomicInteger();
        this.executor = new ScheduledThreadPoolExecutor(threads, r -> {
            Thread t = new Thread(r);
            t.setName("notify4j.timer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    @Override
    public TimerHandle schedule(Instant fireAt, Runnable task) {
        Objects.requireNonNull(fireAt, "fireAt must not be null");
        Objects.requireNonNull(task, "task must not be null");

        long delayMs = delayMillis(clock.instant(), fireAt);
        ScheduledFuture<?> future = executor.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("notify4j timer task failed msg={}", e.getMessage(), e);
            }
        }, delayMs, TimeUnit.MILLISECONDS);
        return new FutureHandle(future);
    }

    /**
     * Milliseconds from {@code now} to {@code fireAt}; 0 when already due, {@link Long#MAX_VALUE} when too far out to count.
     */
    static long delayMillis(Instant now, Instant fireAt) {
        try {
            return Math.max(0, Duration.between(now, fireAt).toMillis());
        } catch (ArithmeticException e) {
            return fireAt.isAfter(now) ? Long.MAX_VALUE : 0;
        }
    }

    @Override
    public Clock clock() {
        return clock;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static final class FutureHandle implements TimerHandle {
        private final ScheduledFuture<?> future;

        private FutureHandle(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
