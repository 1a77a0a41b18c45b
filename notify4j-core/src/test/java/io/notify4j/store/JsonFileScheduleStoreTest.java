package io.notify4j.store;

import io.notify4j.core.NotificationDraft;
import io.notify4j.core.NotificationPatch;
import io.notify4j.core.NotificationType;
import io.notify4j.core.PersistenceException;
import io.notify4j.core.ScheduledNotification;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileScheduleStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-07T00:30:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    @Test
    void recordsShouldSurviveReopen() {
        Path file = dir.resolve("data/schedules.json");
        JsonFileScheduleStore store = new JsonFileScheduleStore(file, CLOCK);

        ScheduledNotification fixed = store.create(new NotificationDraft(NotificationType.FIXED, "stand-up",
                "<b>stand-up</b>", null, "C1", true, "0 9 * * 1-5", null, null));
        ScheduledNotification event = store.create(new NotificationDraft(NotificationType.EVENT, "release",
                "release", "ship it", "C2", true, null, Instant.parse("2026-01-07T05:00:00Z"), "14:00"));
        store.update(fixed.id(), NotificationPatch.enabled(false));

        JsonFileScheduleStore reopened = new JsonFileScheduleStore(file, CLOCK);

        assertEquals(List.of(fixed.withEnabled(false), event), reopened.findAll());
        assertTrue(Files.exists(file));
        assertFalse(Files.exists(file.resolveSibling("schedules.json.tmp")));
    }

    @Test
    void typeShouldBeWrittenAsLowercaseValue() throws Exception {
        Path file = dir.resolve("schedules.json");
        JsonFileScheduleStore store = new JsonFileScheduleStore(file, CLOCK);

        store.create(new NotificationDraft(NotificationType.MANUAL, "call", "call", null, "C1", true, null,
                Instant.parse("2026-01-08T00:00:00Z"), null));

        assertThat(Files.readString(file))
                .contains("\"type\" : \"manual\"")
                .contains("\"scheduledAt\" : \"2026-01-08T00:00:00Z\"");
    }

    @Test
    void deleteShouldRemoveFromFile() {
        Path file = dir.resolve("schedules.json");
        JsonFileScheduleStore store = new JsonFileScheduleStore(file, CLOCK);
        ScheduledNotification created = store.create(new NotificationDraft(NotificationType.FIXED, "a", "a", null,
                "C1", true, "0 9 * * *", null, null));

        assertTrue(store.delete(created.id()));
        assertFalse(store.delete(created.id()));

        assertTrue(new JsonFileScheduleStore(file, CLOCK).findAll().isEmpty());
    }

    @Test
    void unreadableFileShouldFailInsteadOfStartingEmpty() throws Exception {
        Path file = dir.resolve("schedules.json");
        Files.writeString(file, "{ not json");

        assertThrows(PersistenceException.class, () -> new JsonFileScheduleStore(file, CLOCK));
    }

    @Test
    void updateOfUnknownIdShouldReturnEmpty() {
        JsonFileScheduleStore store = new JsonFileScheduleStore(dir.resolve("schedules.json"), CLOCK);

        assertTrue(store.update("missing", NotificationPatch.enabled(true)).isEmpty());
        assertTrue(store.findById("missing").isEmpty());
    }
}
