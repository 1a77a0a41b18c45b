package io.notify4j.core;

import java.time.Instant;

/**
 * Validated fields handed to a {@link io.notify4j.ScheduleStore} for insertion.
 * The store assigns {@code id} and {@code createdAt}.
 */
public record NotificationDraft(
        NotificationType type,
        String name,
        String message,
        String description,
        String chatId,
        boolean enabled,
        String cron,
        Instant scheduledAt,
        String eventTime
) {

    public ScheduledNotification toNotification(String id, Instant createdAt) {
        return new ScheduledNotification(id, type, createdAt, name, message, description, chatId,
                enabled, cron, scheduledAt, eventTime);
    }
}
