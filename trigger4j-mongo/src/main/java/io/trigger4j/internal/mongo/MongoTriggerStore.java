package io.trigger4j.internal.mongo;

import io.trigger4j.core.FieldType;
import io.trigger4j.core.StoreException;
import io.trigger4j.core.Trigger;
import io.trigger4j.core.TriggerKind;
import io.trigger4j.store.TriggerStore;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for triggers (collection {@code triggers}).
 */
public class MongoTriggerStore implements TriggerStore {

    private static final Sort INSERTION_ORDER = Sort.by(Sort.Direction.ASC, "createdAt", "_id");

    private final MongoTemplate mongoTemplate;

    public MongoTriggerStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Trigger insert(Trigger trigger) {
        Objects.requireNonNull(trigger, "trigger must not be null");
        TriggerDocument saved = call("insert trigger", () -> mongoTemplate.insert(toDocument(trigger)));
        return trigger.withId(saved.getId());
    }

    @Override
    public Optional<Trigger> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        TriggerDocument doc = call("find trigger", () -> mongoTemplate.findById(id, TriggerDocument.class));
        return Optional.ofNullable(doc).map(MongoTriggerStore::toTrigger);
    }

    @Override
    public Optional<Trigger> findByIdAndOwner(String id, String ownerId) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Query q = new Query(Criteria.where("_id").is(id).and("ownerId").is(ownerId));
        TriggerDocument doc = call("find trigger", () -> mongoTemplate.findOne(q, TriggerDocument.class));
        return Optional.ofNullable(doc).map(MongoTriggerStore::toTrigger);
    }

    @Override
    public List<Trigger> findByOwner(String ownerId) {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Query q = new Query(Criteria.where("ownerId").is(ownerId)).with(INSERTION_ORDER);
        return call("list triggers", () -> mongoTemplate.find(q, TriggerDocument.class))
                .stream()
                .map(MongoTriggerStore::toTrigger)
                .toList();
    }

    @Override
    public List<Trigger> findAllScheduled() {
        Query q = new Query(Criteria.where("kind").is(TriggerKind.SCHEDULED)).with(INSERTION_ORDER);
        return call("list scheduled triggers", () -> mongoTemplate.find(q, TriggerDocument.class))
                .stream()
                .map(MongoTriggerStore::toTrigger)
                .toList();
    }

    /**
     * Hard delete by document id.
     */
    @Override
    public boolean deleteById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        return call("delete trigger", () -> mongoTemplate.remove(q, TriggerDocument.class)).getDeletedCount() > 0;
    }

    static TriggerDocument toDocument(Trigger trigger) {
        TriggerDocument doc = new TriggerDocument();
        doc.setId(trigger.id());
        doc.setOwnerId(trigger.ownerId());
        doc.setName(trigger.name());
        doc.setKind(trigger.kind());
        doc.setSchedule(trigger.schedule());
        doc.setCreatedAt(trigger.createdAt());

        if (trigger.apiSchema() != null) {
            List<TriggerDocument.SchemaField> fields = new ArrayList<>(trigger.apiSchema().size());
            trigger.apiSchema().forEach((field, type) -> fields.add(new TriggerDocument.SchemaField(field, type.tag())));
            doc.setApiSchema(fields);
        }
        return doc;
    }

    static Trigger toTrigger(TriggerDocument doc) {
        Map<String, FieldType> schema = null;
        if (doc.getApiSchema() != null) {
            schema = new LinkedHashMap<>();
            for (TriggerDocument.SchemaField f : doc.getApiSchema()) {
                FieldType type = FieldType.fromTag(f.getType())
                        .orElseThrow(() -> new IllegalStateException(
                                "Unknown field type '" + f.getType() + "' stored for trigger " + doc.getId()));
                schema.put(f.getField(), type);
            }
        }

        return new Trigger(
                doc.getId(),
                doc.getOwnerId(),
                doc.getName(),
                doc.getKind(),
                doc.getSchedule(),
                schema,
                doc.getCreatedAt()
        );
    }

    private static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }
}
