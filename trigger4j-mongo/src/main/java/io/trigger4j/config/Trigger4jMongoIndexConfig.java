package io.trigger4j.config;

import io.trigger4j.internal.mongo.EventDocument;
import io.trigger4j.internal.mongo.TriggerDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.List;
import java.util.Objects;

/**
 * MongoDB index definitions for trigger4j.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created automatically unless
 * {@code trigger4j.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migrations or ops scripts.
 *
 * <h3>Collection {@code triggers}</h3>
 * <ul>
 *   <li><b>idx_owner_created</b>: { ownerId: 1, createdAt: 1 }
 *       <br/>Owner listing in insertion order and owner-scoped lookups.</li>
 *   <li><b>idx_kind</b>: { kind: 1 }
 *       <br/>Startup reconciliation of scheduled triggers.</li>
 * </ul>
 *
 * <h3>Collection {@code events}</h3>
 * <ul>
 *   <li><b>idx_owner_status_triggered</b>: { ownerId: 1, status: 1, triggeredAt: -1 }
 *       <br/>Recent and archived listings.</li>
 *   <li><b>idx_status_triggered</b>: { status: 1, triggeredAt: 1 }
 *       <br/>Lifecycle sweep.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.triggers.createIndex({ ownerId: 1, createdAt: 1 }, { name: "idx_owner_created" });
 * db.triggers.createIndex({ kind: 1 }, { name: "idx_kind" });
 * db.events.createIndex({ ownerId: 1, status: 1, triggeredAt: -1 }, { name: "idx_owner_status_triggered" });
 * db.events.createIndex({ status: 1, triggeredAt: 1 }, { name: "idx_status_triggered" });
 * </pre>
 */
public class Trigger4jMongoIndexConfig {

    public static final String IDX_OWNER_CREATED = "idx_owner_created";
    public static final String IDX_KIND = "idx_kind";
    public static final String IDX_OWNER_STATUS_TRIGGERED = "idx_owner_status_triggered";
    public static final String IDX_STATUS_TRIGGERED = "idx_status_triggered";

    private final MongoTemplate mongoTemplate;

    public Trigger4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Manually ensure the indexes above. Creating an existing index is a no-op.
     */
    public void ensureIndexes() {
        for (Index index : triggerIndexes()) {
            mongoTemplate.indexOps(TriggerDocument.class).ensureIndex(index);
        }
        for (Index index : eventIndexes()) {
            mongoTemplate.indexOps(EventDocument.class).ensureIndex(index);
        }
    }

    public static List<Index> triggerIndexes() {
        return List.of(
                new Index()
                        .on("ownerId", Sort.Direction.ASC)
                        .on("createdAt", Sort.Direction.ASC)
                        .named(IDX_OWNER_CREATED),
                new Index()
                        .on("kind", Sort.Direction.ASC)
                        .named(IDX_KIND)
        );
    }

    public static List<Index> eventIndexes() {
        return List.of(
                new Index()
                        .on("ownerId", Sort.Direction.ASC)
                        .on("status", Sort.Direction.ASC)
                        .on("triggeredAt", Sort.Direction.DESC)
                        .named(IDX_OWNER_STATUS_TRIGGERED),
                new Index()
                        .on("status", Sort.Direction.ASC)
                        .on("triggeredAt", Sort.Direction.ASC)
                        .named(IDX_STATUS_TRIGGERED)
        );
    }
}
