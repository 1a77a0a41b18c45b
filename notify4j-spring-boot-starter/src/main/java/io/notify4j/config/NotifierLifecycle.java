package io.notify4j.config;

import io.notify4j.NotificationScheduler;
import io.notify4j.internal.DailySummaryAggregator;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler restore/shutdown with the Spring container lifecycle.
 */
public class NotifierLifecycle implements SmartLifecycle {
    private final NotificationScheduler scheduler;
    private final DailySummaryAggregator dailySummary;
    private volatile boolean running = false;

    public NotifierLifecycle(NotificationScheduler scheduler, DailySummaryAggregator dailySummary) {
        this.scheduler = scheduler;
        this.dailySummary = dailySummary;
    }

    @Override
    public void start() {
        scheduler.restoreOnStart();
        dailySummary.register(scheduler);
        running = true;
    }

    @Override
    public void stop() {
        scheduler.shutdown();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
