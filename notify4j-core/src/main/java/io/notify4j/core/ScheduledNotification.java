package io.notify4j.core;

import java.time.Instant;

/**
 * Persisted schedule description. Instances are immutable snapshots of what the store holds.
 */
public record ScheduledNotification(

        // identity
        String id,
        NotificationType type,
        Instant createdAt,

        // content
        String name,
        String message,
        String description,
        String chatId,

        // scheduling
        boolean enabled,
        String cron,
        Instant scheduledAt,
        String eventTime
) {

    /**
     * Text shown in lists and digests: the description, or the message when no description is set.
     */
    public String displayText() {
        return description == null || description.isBlank() ? message : description;
    }

    public ScheduledNotification withEnabled(boolean enabled) {
        return new ScheduledNotification(id, type, createdAt, name, message, description, chatId,
                enabled, cron, scheduledAt, eventTime);
    }

    public boolean isDueAfter(Instant now) {
        return scheduledAt != null && scheduledAt.isAfter(now);
    }
}
