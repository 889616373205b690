package io.trigger4j.registry;

import io.trigger4j.JobScheduler;
import io.trigger4j.core.Event;
import io.trigger4j.core.FieldType;
import io.trigger4j.core.ScheduleDescriptor;
import io.trigger4j.core.Trigger;
import io.trigger4j.core.TriggerKind;
import io.trigger4j.core.TriggerNotFoundException;
import io.trigger4j.core.ValidationException;
import io.trigger4j.store.EventStore;
import io.trigger4j.store.TriggerStore;
import io.trigger4j.utils.PayloadValidator;
import io.trigger4j.utils.ScheduleParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns triggers and the mapping from a scheduled trigger to its scheduler job.
 *
 * <p>Creating a scheduled trigger is atomic as seen by callers: if the job cannot be registered
 * the inserted row is removed again, and a trigger is only deleted after its job is cancelled.
 * Store and scheduler calls are made one after the other, never while holding the scheduler lock.
 */
public class TriggerRegistry {
    private static final Logger log = LoggerFactory.getLogger(TriggerRegistry.class);

    private final TriggerStore triggerStore;
    private final EventStore eventStore;
    private final JobScheduler scheduler;
    private final Clock clock;

    public TriggerRegistry(TriggerStore triggerStore, EventStore eventStore, JobScheduler scheduler, Clock clock) {
        this.triggerStore = Objects.requireNonNull(triggerStore, "triggerStore must not be null");
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Create a trigger firing on an interval ("30" = every 30 minutes) or a 5-field cron expression.
     *
     * @throws io.trigger4j.core.ScheduleException if the schedule is malformed; nothing is persisted
     */
    public Trigger createScheduled(String ownerId, String name, String schedule) {
        requireText(ownerId, "ownerId");
        requireText(name, "name");

        ScheduleDescriptor descriptor = ScheduleParser.parse(schedule);
        Trigger trigger = triggerStore.insert(Trigger.scheduled(ownerId, name, schedule, clock.instant()));

        try {
            scheduler.register(trigger.jobId(), descriptor, this::fire);
        } catch (RuntimeException e) {
            rollbackInsert(trigger, e);
            throw e;
        }

        log.info("Trigger created id={} owner={} kind={} schedule={}", trigger.id(), ownerId, trigger.kind(), schedule);
        return trigger;
    }

    /**
     * Create a trigger fired on demand. Every schema value must be one of the primitive type tags.
     *
     * @param rawSchema field name to type tag, e.g. {"amount": "float", "currency": "str"}
     */
    public Trigger createApi(String ownerId, String name, Map<String, String> rawSchema) {
        requireText(ownerId, "ownerId");
        requireText(name, "name");

        Map<String, FieldType> schema = PayloadValidator.parseSchema(rawSchema);
        Trigger trigger = triggerStore.insert(Trigger.api(ownerId, name, schema, clock.instant()));

        log.info("Trigger created id={} owner={} kind={} fields={}", trigger.id(), ownerId, trigger.kind(), schema.keySet());
        return trigger;
    }

    /**
     * Cancel the trigger's job (if any) and delete the trigger. Its events are kept.
     *
     * @throws TriggerNotFoundException if the owner has no trigger with this id
     */
    public void delete(String ownerId, String triggerId) {
        Trigger trigger = requireOwned(ownerId, triggerId);

        boolean cancelled = scheduler.cancel(trigger.jobId());

        boolean deleted;
        try {
            deleted = triggerStore.deleteById(trigger.id());
        } catch (RuntimeException e) {
            if (trigger.kind() == TriggerKind.SCHEDULED) {
                restoreJob(trigger);
            }
            throw e;
        }
        if (!deleted) {
            // removed concurrently by another caller
            throw new TriggerNotFoundException(triggerId);
        }

        log.info("Trigger deleted id={} owner={} jobCancelled={}", triggerId, ownerId, cancelled);
    }

    public List<Trigger> list(String ownerId) {
        requireText(ownerId, "ownerId");
        return triggerStore.findByOwner(ownerId);
    }

    /**
     * Fire a trigger manually, creating an active test event.
     *
     * <p>For API triggers a non-empty payload is validated against the trigger's schema.
     *
     * @return id of the created event
     */
    public String test(String ownerId, String triggerId, Map<String, Object> payload) {
        Trigger trigger = requireOwned(ownerId, triggerId);

        if (trigger.kind() == TriggerKind.API && payload != null && !payload.isEmpty()) {
            PayloadValidator.validate(payload, trigger.apiSchema());
        }

        Event event = eventStore.insert(Event.forTest(trigger, payload, clock.instant()));
        log.info("Trigger tested id={} owner={} eventId={}", triggerId, ownerId, event.id());
        return event.id();
    }

    /**
     * Register a job for every persisted scheduled trigger. Called once at process start before
     * requests are accepted.
     *
     * @return number of registered jobs
     */
    public int reconcile() {
        List<Trigger> scheduled = triggerStore.findAllScheduled();
        int registered = 0;
        for (Trigger trigger : scheduled) {
            try {
                scheduler.register(trigger.jobId(), ScheduleParser.parse(trigger.schedule()), this::fire);
                registered++;
            } catch (RuntimeException e) {
                log.error("Trigger reconcile failed id={} schedule={} msg={}",
                        trigger.id(), trigger.schedule(), e.getMessage(), e);
            }
        }
        log.info("Trigger reconcile finished registered={} total={}", registered, scheduled.size());
        return registered;
    }

    /**
     * Scheduler callback: one active, non-test event per occurrence. A no-op if the trigger has
     * been deleted in the meantime.
     */
    void fire(String jobId) {
        String triggerId = Trigger.triggerIdOf(jobId);
        if (triggerId == null) {
            log.warn("Trigger fire ignored: unexpected job id={}", jobId);
            return;
        }

        Optional<Trigger> trigger = triggerStore.findById(triggerId);
        if (trigger.isEmpty()) {
            log.debug("Trigger fire skipped: trigger no longer exists id={}", triggerId);
            return;
        }

        Event event = eventStore.insert(Event.fired(trigger.get(), clock.instant()));
        log.debug("Trigger fired id={} eventId={}", triggerId, event.id());
    }

    private Trigger requireOwned(String ownerId, String triggerId) {
        requireText(ownerId, "ownerId");
        if (triggerId == null || triggerId.isBlank()) {
            throw new TriggerNotFoundException(triggerId);
        }
        return triggerStore.findByIdAndOwner(triggerId, ownerId)
                .orElseThrow(() -> new TriggerNotFoundException(triggerId));
    }

    private void rollbackInsert(Trigger trigger, RuntimeException cause) {
        log.warn("Trigger job registration failed; removing trigger id={} msg={}", trigger.id(), cause.getMessage());
        try {
            triggerStore.deleteById(trigger.id());
        } catch (RuntimeException deleteEx) {
            cause.addSuppressed(deleteEx);
            log.error("Trigger rollback failed id={} msg={}", trigger.id(), deleteEx.getMessage(), deleteEx);
        }
    }

    private void restoreJob(Trigger trigger) {
        try {
            scheduler.register(trigger.jobId(), ScheduleParser.parse(trigger.schedule()), this::fire);
        } catch (RuntimeException e) {
            log.error("Trigger job restore failed id={} msg={}", trigger.id(), e.getMessage(), e);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw ValidationException.invalidArgument(name + " must not be blank");
        }
    }
}
