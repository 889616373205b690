package io.trigger4j.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A user-defined rule describing when an event is created.
 *
 * <p>{@code id} is null until the trigger has been inserted into a {@code TriggerStore}.
 * Exactly one of {@code schedule} and {@code apiSchema} is present, matching {@code kind}.
 */
public record Trigger(
        String id,
        String ownerId,
        String name,
        TriggerKind kind,
        String schedule,
        Map<String, FieldType> apiSchema,
        Instant createdAt
) {

    public static final String JOB_ID_PREFIX = "trigger_";

    public Trigger {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");

        if (kind == TriggerKind.SCHEDULED && (schedule == null || apiSchema != null)) {
            throw new IllegalArgumentException("scheduled trigger requires a schedule and no api schema");
        }
        if (kind == TriggerKind.API && (apiSchema == null || schedule != null)) {
            throw new IllegalArgumentException("api trigger requires an api schema and no schedule");
        }
        if (apiSchema != null) {
            apiSchema = Collections.unmodifiableMap(new LinkedHashMap<>(apiSchema));
        }
    }

    public static Trigger scheduled(String ownerId, String name, String schedule, Instant createdAt) {
        return new Trigger(null, ownerId, name, TriggerKind.SCHEDULED, schedule, null, createdAt);
    }

    public static Trigger api(String ownerId, String name, Map<String, FieldType> apiSchema, Instant createdAt) {
        return new Trigger(null, ownerId, name, TriggerKind.API, null, apiSchema, createdAt);
    }

    public Trigger withId(String newId) {
        return new Trigger(newId, ownerId, name, kind, schedule, apiSchema, createdAt);
    }

    /**
     * Scheduler job id for this trigger.
     */
    public String jobId() {
        return jobIdOf(id);
    }

    public static String jobIdOf(String triggerId) {
        Objects.requireNonNull(triggerId, "triggerId must not be null");
        return JOB_ID_PREFIX + triggerId;
    }

    /**
     * Reverse of {@link #jobIdOf(String)}; returns null when the job id was not produced by it.
     */
    public static String triggerIdOf(String jobId) {
        if (jobId == null || !jobId.startsWith(JOB_ID_PREFIX) || jobId.length() == JOB_ID_PREFIX.length()) {
            return null;
        }
        return jobId.substring(JOB_ID_PREFIX.length());
    }
}
