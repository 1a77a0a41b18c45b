package io.notify4j;

import io.notify4j.core.CreateNotificationRequest;
import io.notify4j.core.DispatchException;
import io.notify4j.core.NotificationPatch;
import io.notify4j.core.NotificationType;
import io.notify4j.core.RestoreResult;
import io.notify4j.core.ScheduledNotification;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Main engine API.
 *
 * <p>Keeps one live timer per enabled schedule:
 * <ul>
 *   <li>FIXED schedules tick on their cron expression</li>
 *   <li>MANUAL schedules fire once at {@code scheduledAt} and then disable themselves</li>
 *   <li>EVENT schedules have no timer; they only appear in the daily summary</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.restoreOnStart();
 *
 * scheduler.create(CreateNotificationRequest.fixed("stand-up", "<b>Stand-up</b> in 5 minutes", "55 9 * * 1-5"));
 * scheduler.toggleEnabled(id);
 *
 * scheduler.shutdown();
 * }</pre>
 */
public interface NotificationScheduler {

    /**
     * Rebuild live timers from the store. Call once, before accepting mutations.
     */
    RestoreResult restoreOnStart();

    /**
     * Cancel every live timer. Safe to call repeatedly.
     */
    void shutdown();

    ScheduledNotification create(CreateNotificationRequest request);

    /**
     * Send {@code message} right away, without storing anything. A blank {@code chatId}
     * falls back to the default destination.
     *
     * @throws DispatchException when the dispatcher rejects the message
     */
    void sendNow(String chatId, String message) throws DispatchException;

    /**
     * List schedules, optionally filtered by type and destination. Elapsed one-shot
     * schedules and events not dated today are hidden.
     */
    List<ScheduledNotification> findAll(NotificationType typeFilter, String chatFilter);

    default List<ScheduledNotification> findAll() {
        return findAll(null, null);
    }

    ScheduledNotification findById(String id);

    ScheduledNotification update(String id, NotificationPatch patch);

    void delete(String id);

    ScheduledNotification toggleEnabled(String id);

    /**
     * Register a named recurring task that is not backed by a stored schedule
     * (e.g. the daily summary). Registering the same name again replaces the previous task.
     */
    void registerRecurringTask(String name, String cron, Runnable task);

    boolean isLive(String id);

    /**
     * Next instant the live timer of {@code id} will fire, if it has one.
     */
    Optional<Instant> nextFireTime(String id);

    int liveEntryCount();
}
