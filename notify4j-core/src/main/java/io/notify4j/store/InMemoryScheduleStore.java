package io.notify4j.store;

import io.notify4j.ScheduleStore;
import io.notify4j.core.NotificationDraft;
import io.notify4j.core.NotificationPatch;
import io.notify4j.core.ScheduledNotification;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * {@link ScheduleStore} kept in process memory, in creation order.
 *
 * <p>Writes are applied to a copy which is handed to {@link #persist(List)} before it becomes visible,
 * so a subclass that fails to persist leaves the visible state unchanged.
 */
public class InMemoryScheduleStore implements ScheduleStore {

    private final Clock clock;
    private LinkedHashMap<String, ScheduledNotification> records = new LinkedHashMap<>();

    public InMemoryScheduleStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public synchronized List<ScheduledNotification> findAll() {
        return List.copyOf(records.values());
    }

    @Override
    public synchronized Optional<ScheduledNotification> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public synchronized ScheduledNotification create(NotificationDraft draft) {
        Objects.requireNonNull(draft, "draft must not be null");
        ScheduledNotification created = draft.toNotification(UUID.randomUUID().toString(), clock.instant());
        commit(next -> next.put(created.id(), created));
        return created;
    }

    @Override
    public synchronized Optional<ScheduledNotification> update(String id, NotificationPatch patch) {
        Objects.requireNonNull(patch, "patch must not be null");
        ScheduledNotification current = records.get(id);
        if (current == null) {
            return Optional.empty();
        }
        ScheduledNotification updated = patch.applyTo(current);
        commit(next -> next.put(id, updated));
        return Optional.of(updated);
    }

    @Override
    public synchronized boolean delete(String id) {
        if (!records.containsKey(id)) {
            return false;
        }
        commit(next -> next.remove(id));
        return true;
    }

    /**
     * Replace the content with previously persisted records.
     */
    protected synchronized void load(List<ScheduledNotification> loaded) {
        LinkedHashMap<String, ScheduledNotification> next = new LinkedHashMap<>();
        loaded.stream()
                .sorted(Comparator.comparing(ScheduledNotification::createdAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .forEach(n -> next.put(n.id(), n));
        records = next;
    }

    /**
     * Hook for durable subclasses; called with the full new content before a write becomes visible.
     */
    protected void persist(List<ScheduledNotification> snapshot) {
    }

    private void commit(Consumer<LinkedHashMap<String, ScheduledNotification>> change) {
        LinkedHashMap<String, ScheduledNotification> next = new LinkedHashMap<>(records);
        change.accept(next);
        persist(List.copyOf(next.values()));
        records = next;
    }
}
