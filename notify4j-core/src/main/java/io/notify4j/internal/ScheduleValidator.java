package io.notify4j.internal;

import io.notify4j.core.CreateNotificationRequest;
import io.notify4j.core.NotificationPatch;
import io.notify4j.core.NotificationType;
import io.notify4j.core.ScheduleValidationException;
import io.notify4j.core.ScheduledNotification;
import io.notify4j.core.ValidationFailure;
import io.notify4j.utils.CronMatcher;

import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Request checks shared by create and update. Throws before anything is written.
 */
final class ScheduleValidator {

    private static final Pattern EVENT_TIME = Pattern.compile("^([01]?\\d|2[0-3]):[0-5]\\d$");

    void validateCreate(CreateNotificationRequest request, Instant now) {
        NotificationType type = request.type();
        if (type == null) {
            throw new ScheduleValidationException(ValidationFailure.MISSING_TYPE, "type is required");
        }
        requireText(request.name(), ValidationFailure.MISSING_NAME, "name must not be blank");
        requireText(request.message(), ValidationFailure.MISSING_MESSAGE, "message must not be blank");

        if (type == NotificationType.FIXED) {
            requireText(request.cron(), ValidationFailure.MISSING_CRON_FOR_FIXED,
                    "cron is required for fixed schedules");
            checkCron(request.cron());
        } else {
            if (request.scheduledAt() == null) {
                throw new ScheduleValidationException(ValidationFailure.MISSING_TIMESTAMP_FOR_MANUAL_OR_EVENT,
                        "scheduledAt is required for " + type + " schedules");
            }
            if (type == NotificationType.MANUAL) {
                requireFuture(request.scheduledAt(), now);
            }
        }
        checkEventTime(request.eventTime());
    }

    void validatePatch(ScheduledNotification existing, NotificationPatch patch, Instant now) {
        if (patch.name() != null) {
            requireText(patch.name(), ValidationFailure.MISSING_NAME, "name must not be blank");
        }
        if (patch.message() != null) {
            requireText(patch.message(), ValidationFailure.MISSING_MESSAGE, "message must not be blank");
        }
        if (patch.chatId() != null) {
            requireText(patch.chatId(), ValidationFailure.MISSING_CHAT_ID, "chatId must not be blank");
        }
        if (patch.cron() != null) {
            if (existing.type() == NotificationType.FIXED) {
                requireText(patch.cron(), ValidationFailure.MISSING_CRON_FOR_FIXED,
                        "cron is required for fixed schedules");
            }
            if (!patch.cron().isBlank()) {
                checkCron(patch.cron());
            }
        }
        if (patch.scheduledAt() != null && existing.type() == NotificationType.MANUAL) {
            requireFuture(patch.scheduledAt(), now);
        }
        checkEventTime(patch.eventTime());
    }

    void requireFuture(Instant scheduledAt, Instant now) {
        if (scheduledAt == null || !scheduledAt.isAfter(now)) {
            throw new ScheduleValidationException(ValidationFailure.PAST_SCHEDULED_TIME,
                    "scheduledAt of a manual schedule must be in the future: " + scheduledAt);
        }
    }

    private static void checkCron(String cron) {
        try {
            CronMatcher.validate(cron);
        } catch (IllegalArgumentException ex) {
            throw new ScheduleValidationException(ValidationFailure.INVALID_CRON, ex.getMessage());
        }
    }

    private static void checkEventTime(String eventTime) {
        if (eventTime != null && !eventTime.isBlank() && !EVENT_TIME.matcher(eventTime.trim()).matches()) {
            throw new ScheduleValidationException(ValidationFailure.INVALID_EVENT_TIME,
                    "eventTime must be HH:MM: " + eventTime);
        }
    }

    private static void requireText(String value, ValidationFailure failure, String message) {
        if (value == null || value.isBlank()) {
            throw new ScheduleValidationException(failure, message);
        }
    }
}
