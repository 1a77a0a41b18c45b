package io.notify4j;

import io.notify4j.core.NotificationDraft;
import io.notify4j.core.NotificationPatch;
import io.notify4j.core.ScheduledNotification;

import java.util.List;
import java.util.Optional;

/**
 * Durable CRUD over schedule records.
 *
 * <p>Implementations report storage failures as {@link io.notify4j.core.PersistenceException}.
 */
public interface ScheduleStore {

    /**
     * All records, oldest-created first.
     */
    List<ScheduledNotification> findAll();

    Optional<ScheduledNotification> findById(String id);

    /**
     * Insert a record, assigning its id and creation time.
     */
    ScheduledNotification create(NotificationDraft draft);

    /**
     * Apply a partial update.
     *
     * @return the updated record, or empty if {@code id} is unknown
     */
    Optional<ScheduledNotification> update(String id, NotificationPatch patch);

    /**
     * @return true iff a record was removed
     */
    boolean delete(String id);
}
