package io.trigger4j.internal.mongo;

import io.trigger4j.core.Event;
import io.trigger4j.core.EventStatus;
import io.trigger4j.core.StoreException;
import io.trigger4j.core.SweepResult;
import io.trigger4j.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for events (collection {@code events}).
 *
 * <p>The lifecycle sweep runs both of its update steps inside one transaction of the given
 * {@link TransactionTemplate}, which must be backed by a {@code MongoTransactionManager} over the
 * same database factory as the {@link MongoTemplate}. Transactions need a replica set.
 */
public class MongoEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(MongoEventStore.class);

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "triggeredAt", "_id");

    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate transactionTemplate;

    public MongoEventStore(MongoTemplate mongoTemplate, TransactionTemplate transactionTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate must not be null");
    }

    @Override
    public Event insert(Event event) {
        Objects.requireNonNull(event, "event must not be null");
        try {
            EventDocument saved = mongoTemplate.insert(toDocument(event));
            return event.withId(saved.getId());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to insert event: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Event> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        try {
            return Optional.ofNullable(mongoTemplate.findById(id, EventDocument.class)).map(MongoEventStore::toEvent);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to find event: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Event> findActiveSince(String ownerId, boolean includeTest, Instant since, long offset, int limit) {
        Criteria c = ownerCriteria(ownerId, EventStatus.ACTIVE, includeTest)
                .and("triggeredAt").gte(since);
        return page(c, offset, limit);
    }

    @Override
    public List<Event> findArchivedBetween(String ownerId,
                                           boolean includeTest,
                                           Instant fromExclusive,
                                           Instant toInclusive,
                                           long offset,
                                           int limit) {
        Criteria c = ownerCriteria(ownerId, EventStatus.ARCHIVED, includeTest)
                .and("triggeredAt").gt(fromExclusive).lte(toInclusive);
        return page(c, offset, limit);
    }

    @Override
    public SweepResult sweep(Instant now, Instant archiveCutoff, Instant deleteCutoff) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(archiveCutoff, "archiveCutoff must not be null");
        Objects.requireNonNull(deleteCutoff, "deleteCutoff must not be null");

        try {
            SweepResult result = transactionTemplate.execute(status -> {
                long archived = mongoTemplate.updateMulti(
                        new Query(Criteria.where("status").is(EventStatus.ACTIVE).and("triggeredAt").lte(archiveCutoff)),
                        new Update().set("status", EventStatus.ARCHIVED).set("archivedAt", now),
                        EventDocument.class
                ).getModifiedCount();

                long deleted = mongoTemplate.updateMulti(
                        new Query(Criteria.where("status").is(EventStatus.ARCHIVED).and("triggeredAt").lte(deleteCutoff)),
                        new Update().set("status", EventStatus.DELETED).set("deletedAt", now),
                        EventDocument.class
                ).getModifiedCount();

                return new SweepResult(archived, deleted, now);
            });
            log.debug("Mongo sweep committed archived={} deleted={}", result.archived(), result.deleted());
            return result;
        } catch (DataAccessException | TransactionException e) {
            throw new StoreException("Event sweep failed: " + e.getMessage(), e);
        }
    }

    private List<Event> page(Criteria criteria, long offset, int limit) {
        // the driver's skip is an int
        if (offset > Integer.MAX_VALUE) {
            return List.of();
        }
        Query q = new Query(criteria).with(NEWEST_FIRST).skip(offset).limit(limit);
        try {
            return mongoTemplate.find(q, EventDocument.class).stream().map(MongoEventStore::toEvent).toList();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to query events: " + e.getMessage(), e);
        }
    }

    private static Criteria ownerCriteria(String ownerId, EventStatus status, boolean includeTest) {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Criteria c = Criteria.where("ownerId").is(ownerId).and("status").is(status);
        if (!includeTest) {
            c = c.and("test").is(false);
        }
        return c;
    }

    static EventDocument toDocument(Event event) {
        EventDocument doc = new EventDocument();
        doc.setId(event.id());
        doc.setTriggerId(event.triggerId());
        doc.setOwnerId(event.ownerId());
        doc.setStatus(event.status());
        doc.setPayload(event.payload());
        doc.setTest(event.test());
        doc.setTriggeredAt(event.triggeredAt());
        doc.setArchivedAt(event.archivedAt());
        doc.setDeletedAt(event.deletedAt());
        return doc;
    }

    static Event toEvent(EventDocument doc) {
        return new Event(
                doc.getId(),
                doc.getTriggerId(),
                doc.getOwnerId(),
                doc.getStatus(),
                doc.getPayload(),
                doc.isTest(),
                doc.getTriggeredAt(),
                doc.getArchivedAt(),
                doc.getDeletedAt()
        );
    }
}
