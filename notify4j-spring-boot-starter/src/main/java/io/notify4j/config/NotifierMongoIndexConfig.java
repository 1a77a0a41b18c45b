package io.notify4j.config;

import io.notify4j.internal.mongo.ScheduledNotificationDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the schedule collection.
 *
 * <p>Indexes are not created at startup unless {@code notifier.ensure-indexes-on-startup=true};
 * in production they usually come from migrations or ops scripts.
 *
 * <h3>Indexes (collection: {@code scheduled_notifications})</h3>
 * <ul>
 *   <li><b>idx_createdAt</b>: { createdAt: 1 }
 *       <br/>Used by the oldest-first listing that restore and the daily summary read.</li>
 *   <li><b>idx_chatId_type</b>: { chatId: 1, type: 1 }
 *       <br/>Used by per-destination listings filtered by type.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.scheduled_notifications.createIndex({ createdAt: 1 }, { name: "idx_createdAt" });
 * db.scheduled_notifications.createIndex({ chatId: 1, type: 1 }, { name: "idx_chatId_type" });
 * </pre>
 */
public class NotifierMongoIndexConfig {

    public static final String IDX_CREATED_AT = "idx_createdAt";
    public static final String IDX_CHAT_ID_TYPE = "idx_chatId_type";

    private final MongoTemplate mongoTemplate;

    public NotifierMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduledNotificationDocument.class).ensureIndex(createdAtIndex());
        mongoTemplate.indexOps(ScheduledNotificationDocument.class).ensureIndex(chatIdTypeIndex());
    }

    public static Index createdAtIndex() {
        return new Index()
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_CREATED_AT);
    }

    public static Index chatIdTypeIndex() {
        return new Index()
                .on("chatId", Sort.Direction.ASC)
                .on("type", Sort.Direction.ASC)
                .named(IDX_CHAT_ID_TYPE);
    }
}
