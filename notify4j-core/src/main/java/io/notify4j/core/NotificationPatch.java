package io.notify4j.core;

import java.time.Instant;

/**
 * Partial update of a schedule. A {@code null} field means "leave unchanged".
 *
 * <p>Type, id and creation time are immutable and cannot be patched.
 */
public final class NotificationPatch {

    private final String name;
    private final String message;
    private final String description;
    private final String chatId;
    private final String cron;
    private final Instant scheduledAt;
    private final String eventTime;
    private final Boolean enabled;

    private NotificationPatch(Builder b) {
        this.name = b.name;
        this.message = b.message;
        this.description = b.description;
        this.chatId = b.chatId;
        this.cron = b.cron;
        this.scheduledAt = b.scheduledAt;
        this.eventTime = b.eventTime;
        this.enabled = b.enabled;
    }

    public static NotificationPatch enabled(boolean enabled) {
        return builder().enabled(enabled).build();
    }

    public String name() {
        return name;
    }

    public String message() {
        return message;
    }

    public String description() {
        return description;
    }

    public String chatId() {
        return chatId;
    }

    public String cron() {
        return cron;
    }

    public Instant scheduledAt() {
        return scheduledAt;
    }

    public String eventTime() {
        return eventTime;
    }

    public Boolean enabled() {
        return enabled;
    }

    public boolean isEmpty() {
        return name == null && message == null && description == null && chatId == null
                && cron == null && scheduledAt == null && eventTime == null && enabled == null;
    }

    /**
     * Returns a copy of {@code current} with every non-null field of this patch applied.
     */
    public ScheduledNotification applyTo(ScheduledNotification current) {
        return new ScheduledNotification(
                current.id(),
                current.type(),
                current.createdAt(),
                name != null ? name : current.name(),
                message != null ? message : current.message(),
                description != null ? description : current.description(),
                chatId != null ? chatId : current.chatId(),
                enabled != null ? enabled : current.enabled(),
                cron != null ? cron : current.cron(),
                scheduledAt != null ? scheduledAt : current.scheduledAt(),
                eventTime != null ? eventTime : current.eventTime()
        );
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("NotificationPatch{");
        append(sb, "name", name);
        append(sb, "message", message);
        append(sb, "description", description);
        append(sb, "chatId", chatId);
        append(sb, "cron", cron);
        append(sb, "scheduledAt", scheduledAt);
        append(sb, "eventTime", eventTime);
        append(sb, "enabled", enabled);
        if (sb.charAt(sb.length() - 1) == ' ') {
            sb.setLength(sb.length() - 2);
        }
        return sb.append('}').toString();
    }

    private static void append(StringBuilder sb, String key, Object value) {
        if (value != null) {
            sb.append(key).append('=').append(value).append(", ");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String message;
        private String description;
        private String chatId;
        private String cron;
        private Instant scheduledAt;
        private String eventTime;
        private Boolean enabled;

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

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public NotificationPatch build() {
            return new NotificationPatch(this);
        }
    }
}
