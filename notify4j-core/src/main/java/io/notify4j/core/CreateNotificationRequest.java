package io.notify4j.core;

import java.time.Instant;

/**
 * Input of {@link io.notify4j.NotificationScheduler#create(CreateNotificationRequest)}.
 *
 * <p>{@code chatId} may be omitted, in which case the configured default destination is used.
 */
public record CreateNotificationRequest(
        NotificationType type,
        String name,
        String message,
        String description,
        String chatId,
        String cron,
        Instant scheduledAt,
        String eventTime
) {

    public static Builder builder(NotificationType type) {
        return new Builder(type);
    }

    public static CreateNotificationRequest fixed(String name, String message, String cron) {
        return builder(NotificationType.FIXED).name(name).message(message).cron(cron).build();
    }

    public static CreateNotificationRequest manual(String name, String message, Instant scheduledAt) {
        return builder(NotificationType.MANUAL).name(name).message(message).scheduledAt(scheduledAt).build();
    }

    public static CreateNotificationRequest event(String name, String message, Instant scheduledAt) {
        return builder(NotificationType.EVENT).name(name).message(message).scheduledAt(scheduledAt).build();
    }

    public static final class Builder {
        private final NotificationType type;
        private String name;
        private String message;
        private String description;
        private String chatId;
        private String cron;
        private Instant scheduledAt;
        private String eventTime;

        private Builder(NotificationType type) {
            this.type = type;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder chatId(String chatId) {
            this.chatId = chatId;
            return this;
        }

        public Builder cron(String cron) {
            this.cron = cron;
            return this;
        }

        public Builder scheduledAt(Instant scheduledAt) {
            this.scheduledAt = scheduledAt;
            return this;
        }

        public Builder eventTime(String eventTime) {
            this.eventTime = eventTime;
            return this;
        }

        public CreateNotificationRequest build() {
            return new CreateNotificationRequest(type, name, message, description, chatId, cron, scheduledAt, eventTime);
        }
    }
}
