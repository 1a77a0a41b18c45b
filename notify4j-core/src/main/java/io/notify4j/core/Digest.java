package io.notify4j.core;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * What one destination gets to see for {@code date}: events (display-only entries)
 * and alarms (FIXED and MANUAL schedules firing that day), alarms ordered by time.
 */
public record Digest(
        String chatId,
        LocalDate date,
        List<Item> events,
        List<Item> alarms
) {

    public Digest {
        events = List.copyOf(events);
        alarms = List.copyOf(alarms);
    }

    public int total() {
        return events.size() + alarms.size();
    }

    /**
     * @param time      local fire time; null for events
     * @param eventTime optional {@code HH:MM} shown instead of {@code time}
     * @param text      description, or message when no description is set
     */
    public record Item(
            String scheduleId,
            String name,
            NotificationType type,
            LocalTime time,
            String eventTime,
            String text
    ) {
    }
}
