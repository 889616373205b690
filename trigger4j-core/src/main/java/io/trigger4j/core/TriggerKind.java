package io.trigger4j.core;

public enum TriggerKind {
    SCHEDULED,
    API
}
