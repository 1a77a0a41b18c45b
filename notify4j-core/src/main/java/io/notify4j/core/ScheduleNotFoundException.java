package io.notify4j.core;

public class ScheduleNotFoundException extends NotifierException {

    private final String scheduleId;

    public ScheduleNotFoundException(String scheduleId) {
        super("Schedule not found: " + scheduleId);
        this.scheduleId = scheduleId;
    }

    public String scheduleId() {
        return scheduleId;
    }
}
