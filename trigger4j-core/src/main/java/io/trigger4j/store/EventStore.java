package io.trigger4j.store;

import io.trigger4j.core.Event;
import io.trigger4j.core.SweepResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of events. Implementations wrap data-access failures in
 * {@link io.trigger4j.core.StoreException}.
 */
public interface EventStore {

    /**
     * Insert an event that has no id yet and return it with the assigned id.
     */
    Event insert(Event event);

    Optional<Event> findById(String id);

    /**
     * ACTIVE events of an owner with {@code triggeredAt >= since}, newest first.
     */
    List<Event> findActiveSince(String ownerId, boolean includeTest, Instant since, long offset, int limit);

    /**
     * ARCHIVED events of an owner with {@code fromExclusive < triggeredAt <= toInclusive}, newest first.
     */
    List<Event> findArchivedBetween(String ownerId,
                                    boolean includeTest,
                                    Instant fromExclusive,
                                    Instant toInclusive,
                                    long offset,
                                    int limit);

    /**
     * In one transaction: archive ACTIVE events with {@code triggeredAt <= archiveCutoff}, then delete
     * ARCHIVED events (including the ones just archived) with {@code triggeredAt <= deleteCutoff}.
     * Either both steps are committed or neither is.
     */
    SweepResult sweep(Instant now, Instant archiveCutoff, Instant deleteCutoff);
}
