package io.notify4j.internal.mongo;

import io.notify4j.ScheduleStore;
import io.notify4j.core.NotificationDraft;
import io.notify4j.core.NotificationPatch;
import io.notify4j.core.PersistenceException;
import io.notify4j.core.ScheduledNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * MongoDB persistence layer for schedules (collection {@value ScheduledNotificationDocument#COLLECTION}).
 *
 * <p>Ids are Mongo ObjectIds rendered as hex strings. Driver failures surface as {@link PersistenceException}.
 */
public class MongoScheduleStore implements ScheduleStore {
    private static final Logger log = LoggerFactory.getLogger(MongoScheduleStore.class);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoScheduleStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<ScheduledNotification> findAll() {
        Query q = new Query().with(Sort.by(Sort.Direction.ASC, "createdAt").and(Sort.by(Sort.Direction.ASC, "_id")));
        return call("findAll", () -> mongoTemplate.find(q, ScheduledNotificationDocument.class))
                .stream()
                .map(MongoScheduleStore::toNotification)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<ScheduledNotification> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(call("findById", () -> mongoTemplate.findById(id, ScheduledNotificationDocument.class)))
                .map(MongoScheduleStore::toNotification);
    }

    @Override
    public ScheduledNotification create(NotificationDraft draft) {
        Objects.requireNonNull(draft, "draft must not be null");
        ScheduledNotificationDocument doc = toDocument(draft, clock.instant());
        ScheduledNotificationDocument saved = call("create", () -> mongoTemplate.insert(doc));
        log.debug("Inserted schedule id={} name={}", saved.getId(), saved.getName());
        return toNotification(saved);
    }

    @Override
    public Optional<ScheduledNotification> update(String id, NotificationPatch patch) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(patch, "patch must not be null");

        Query q = new Query(Criteria.where("_id").is(id));
        if (patch.isEmpty()) {
            return findById(id);
        }
        Update u = buildUpdate(patch);
        FindAndModifyOptions opts = FindAndModifyOptions.options().returnNew(true);

        return Optional.ofNullable(call("update",
                        () -> mongoTemplate.findAndModify(q, u, opts, ScheduledNotificationDocument.class)))
                .map(MongoScheduleStore::toNotification);
    }

    @Override
    public boolean delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        return call("delete", () -> mongoTemplate.remove(q, ScheduledNotificationDocument.class)).getDeletedCount() > 0;
    }

    /* ================= helper ================= */

    private static Update buildUpdate(NotificationPatch patch) {
        Update u = new Update();
        if (patch.name() != null) {
            u.set("name", patch.name());
        }
        if (patch.message() != null) {
            u.set("message", patch.message());
        }
        if (patch.description() != null) {
            u.set("description", patch.description());
        }
        if (patch.chatId() != null) {
            u.set("chatId", patch.chatId());
        }
        if (patch.cron() != null) {
            u.set("cron", patch.cron());
        }
        if (patch.scheduledAt() != null) {
            u.set("scheduledAt", patch.scheduledAt());
        }
        if (patch.eventTime() != null) {
            u.set("eventTime", patch.eventTime());
        }
        if (patch.enabled() != null) {
            u.set("enabled", patch.enabled());
        }
        return u;
    }

    static ScheduledNotificationDocument toDocument(NotificationDraft draft, Instant createdAt) {
        ScheduledNotificationDocument doc = new ScheduledNotificationDocument();
        doc.setType(draft.type());
        doc.setCreatedAt(createdAt);
        doc.setName(draft.name());
        doc.setMessage(draft.message());
        doc.setDescription(draft.description());
        doc.setChatId(draft.chatId());
        doc.setEnabled(draft.enabled());
        doc.setCron(draft.cron());
        doc.setScheduledAt(draft.scheduledAt());
        doc.setEventTime(draft.eventTime());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(NotificationDraft, Instant)}.
     */
    static ScheduledNotification toNotification(ScheduledNotificationDocument doc) {
        return new ScheduledNotification(
                doc.getId(),
                doc.getType(),
                doc.getCreatedAt(),
                doc.getName(),
                doc.getMessage(),
                doc.getDescription(),
                doc.getChatId(),
                doc.isEnabled(),
                doc.getCron(),
                doc.getScheduledAt(),
                doc.getEventTime()
        );
    }

    private static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Mongo {} failed msg={}", operation, e.getMessage(), e);
            throw new PersistenceException("Mongo " + operation + " failed", e);
        }
    }
}
