package io.notify4j.core;

/** Reason a schedule request was rejected. */
public enum ValidationFailure {
    /** A FIXED schedule without a cron expression. */
    MISSING_CRON_FOR_FIXED("missing_cron_for_fixed"),
    /** A MANUAL or EVENT schedule without an absolute instant. */
    MISSING_TIMESTAMP_FOR_MANUAL_OR_EVENT("missing_timestamp_for_manual_or_event"),
    /** A MANUAL schedule created, moved or re-enabled at a non-future instant. */
    PAST_SCHEDULED_TIME("past_scheduled_time"),
    MISSING_TYPE("missing_type"),
    MISSING_NAME("missing_name"),
    MISSING_MESSAGE("missing_message"),
    MISSING_CHAT_ID("missing_chat_id"),
    /** Cron text outside the supported five-field subset. */
    INVALID_CRON("invalid_cron"),
    /** Display time not in HH:MM form. */
    INVALID_EVENT_TIME("invalid_event_time");

    private final String code;

    ValidationFailure(String code) {
        this.code = code;
    }

    @Override
    public String toString() {
        return code;
    }
}
