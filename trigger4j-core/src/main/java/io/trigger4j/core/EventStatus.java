package io.trigger4j.core;

/**
 * Event lifecycle status. Transitions only move one step forward:
 * ACTIVE -> ARCHIVED -> DELETED.
 */
public enum EventStatus {
    ACTIVE,
    ARCHIVED,
    DELETED;

    public boolean canTransitionTo(EventStatus next) {
        return next != null && next.ordinal() == this.ordinal() + 1;
    }
}
