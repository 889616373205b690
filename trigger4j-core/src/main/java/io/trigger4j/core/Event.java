package io.trigger4j.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Record of one firing of a trigger.
 *
 * <p>{@code ownerId} is copied from the trigger when the event is created, so the event stays
 * readable by its owner after the trigger is deleted.
 */
public record Event(
        String id,
        String triggerId,
        String ownerId,
        EventStatus status,
        Map<String, Object> payload,
        boolean test,
        Instant triggeredAt,
        Instant archivedAt,
        Instant deletedAt
) {

    public Event {
        Objects.requireNonNull(triggerId, "triggerId must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(triggeredAt, "triggeredAt must not be null");

        boolean archived = status == EventStatus.ARCHIVED || status == EventStatus.DELETED;
        if (archived != (archivedAt != null)) {
            throw new IllegalArgumentException("archivedAt must be set iff status is ARCHIVED or DELETED");
        }
        if ((status == EventStatus.DELETED) != (deletedAt != null)) {
            throw new IllegalArgumentException("deletedAt must be set iff status is DELETED");
        }
        if (payload != null) {
            payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        }
    }

    /**
     * Event created by a scheduled firing: active, not a test, no payload.
     */
    public static Event fired(Trigger trigger, Instant triggeredAt) {
        return new Event(null, trigger.id(), trigger.ownerId(), EventStatus.ACTIVE, null, false, triggeredAt, null, null);
    }

    public static Event forTest(Trigger trigger, Map<String, Object> payload, Instant triggeredAt) {
        return new Event(null, trigger.id(), trigger.ownerId(), EventStatus.ACTIVE, payload, true, triggeredAt, null, null);
    }

    public Event withId(String newId) {
        return new Event(newId, triggerId, ownerId, status, payload, test, triggeredAt, archivedAt, deletedAt);
    }

    public Event archive(Instant at) {
        requireTransition(EventStatus.ARCHIVED);
        return new Event(id, triggerId, ownerId, EventStatus.ARCHIVED, payload, test, triggeredAt, at, null);
    }

    public Event delete(Instant at) {
        requireTransition(EventStatus.DELETED);
        return new Event(id, triggerId, ownerId, EventStatus.DELETED, payload, test, triggeredAt, archivedAt, at);
    }

    private void requireTransition(EventStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal event transition " + status + " -> " + next + " id=" + id);
        }
    }
}
