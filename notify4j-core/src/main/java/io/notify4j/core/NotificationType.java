package io.notify4j.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of scheduled notification.
 *
 * <p>Only FIXED and MANUAL schedules own a live timer; EVENT entries are dated
 * display items that only show up in the daily summary.
 */
public enum NotificationType {
    FIXED("fixed") {
        @Override
        public boolean isLiveScheduled() {
            return true;
        }
    },
    MANUAL("manual") {
        @Override
        public boolean isLiveScheduled() {
            return true;
        }
    },
    EVENT("event") {
        @Override
        public boolean isLiveScheduled() {
            return false;
        }
    };

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public abstract boolean isLiveScheduled();

    /**
     * Resolves the lowercase wire value ("fixed", "manual", "event"), case-insensitively.
     */
    @JsonCreator
    public static NotificationType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("notification type must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (NotificationType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown notification type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
