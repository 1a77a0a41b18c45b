package io.notify4j.timer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Test timer driven by hand: time only moves on {@link #advance(Duration)}, which runs due tasks
 * on the calling thread in fire-time order.
 */
public class ManualTaskTimer implements TaskTimer {

    private final MutableClock clock;
    private final List<Pending> pending = new ArrayList<>();
    private long sequence;

    public ManualTaskTimer(Instant start) {
        this.clock = new MutableClock(start);
    }

    @Override
    public synchronized TimerHandle schedule(Instant fireAt, Runnable task) {
        Pending p = new Pending(fireAt, sequence++, task);
        pending.add(p);
        return p;
    }

    @Override
    public Clock clock() {
        return clock;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Moves time forward, running every task that becomes due (including tasks scheduled by those tasks).
     */
    public void advance(Duration duration) {
        Instant target = clock.instant().plus(duration);
        while (true) {
            Optional<Pending> next = nextDue(target);
            if (next.isEmpty()) {
                break;
            }
            Pending p = next.get();
            if (p.fireAt.isAfter(clock.instant())) {
                clock.set(p.fireAt);
            }
            p.task.run();
        }
        // a task may itself have advanced past the target
        if (target.isAfter(clock.instant())) {
            clock.set(target);
        }
    }

    public synchronized int pendingCount() {
        return (int) pending.stream().filter(p -> !p.cancelled).count();
    }

    @Override
    public void close() {
        synchronized (this) {
            pending.clear();
        }
    }

    private synchronized Optional<Pending> nextDue(Instant target) {
        pending.removeIf(p -> p.cancelled);
        Optional<Pending> next = pending.stream()
                .filter(p -> !p.fireAt.isAfter(target))
                .min(Comparator.comparing((Pending p) -> p.fireAt).thenComparingLong(p -> p.seq));
        next.ifPresent(pending::remove);
        return next;
    }

    private static final class Pending implements TimerHandle {
        private final Instant fireAt;
        private final long seq;
        private final Runnable task;
        private volatile boolean cancelled;

        private Pending(Instant fireAt, long seq, Runnable task) {
            this.fireAt = fireAt;
            this.seq = seq;
            this.task = task;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }

    static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void set(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return Clock.fixed(now, zone);
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
