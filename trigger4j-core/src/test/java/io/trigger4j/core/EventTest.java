package io.trigger4j.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final Trigger TRIGGER =
            Trigger.api("u1", "payments", Map.of("amount", FieldType.FLOAT), T0).withId("t1");

    @Test
    void statusShouldOnlyMoveForwardOneStep() {
        assertTrue(EventStatus.ACTIVE.canTransitionTo(EventStatus.ARCHIVED));
        assertTrue(EventStatus.ARCHIVED.canTransitionTo(EventStatus.DELETED));
        assertFalse(EventStatus.ACTIVE.canTransitionTo(EventStatus.DELETED));
        assertFalse(EventStatus.DELETED.canTransitionTo(EventStatus.ARCHIVED));
        assertFalse(EventStatus.ARCHIVED.canTransitionTo(EventStatus.ACTIVE));
    }

    @Test
    void timestampsShouldBeSetOnceAlongTransitions() {
        Event active = Event.fired(TRIGGER, T0);
        Event archived = active.archive(T0.plusSeconds(10));
        Event deleted = archived.delete(T0.plusSeconds(20));

        assertNull(active.archivedAt());
        assertEquals(T0.plusSeconds(10), deleted.archivedAt());
        assertEquals(T0.plusSeconds(20), deleted.deletedAt());
        assertEquals(T0, deleted.triggeredAt());

        assertThrows(IllegalStateException.class, () -> deleted.archive(T0.plusSeconds(30)));
        assertThrows(IllegalStateException.class, () -> archived.archive(T0.plusSeconds(30)));
        assertThrows(IllegalStateException.class, () -> active.delete(T0.plusSeconds(30)));
    }

    @Test
    void inconsistentTimestampsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Event(
                "e1", "t1", "u1", EventStatus.ACTIVE, null, false, T0, T0, null));
        assertThrows(IllegalArgumentException.class, () -> new Event(
                "e1", "t1", "u1", EventStatus.DELETED, null, false, T0, T0, null));
    }

    @Test
    void jobIdShouldMapBothWays() {
        assertEquals("trigger_t1", TRIGGER.jobId());
        assertEquals("t1", Trigger.triggerIdOf("trigger_t1"));
        assertNull(Trigger.triggerIdOf("trigger_"));
        assertNull(Trigger.triggerIdOf("job_t1"));
    }
}
