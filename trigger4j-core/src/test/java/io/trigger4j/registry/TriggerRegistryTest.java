package io.trigger4j.registry;

import io.trigger4j.config.Trigger4jProperties;
import io.trigger4j.core.ErrorKind;
import io.trigger4j.core.Event;
import io.trigger4j.core.EventStatus;
import io.trigger4j.core.FieldType;
import io.trigger4j.core.ScheduleException;
import io.trigger4j.core.StoreException;
import io.trigger4j.core.Trigger;
import io.trigger4j.core.TriggerKind;
import io.trigger4j.core.TriggerNotFoundException;
import io.trigger4j.core.ValidationException;
import io.trigger4j.internal.InMemoryJobScheduler;
import io.trigger4j.support.InMemoryEventStore;
import io.trigger4j.support.InMemoryTriggerStore;
import io.trigger4j.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class TriggerRegistryTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private MutableClock clock;
    private InMemoryTriggerStore triggerStore;
    private InMemoryEventStore eventStore;
    private InMemoryJobScheduler scheduler;
    private TriggerRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        triggerStore = new InMemoryTriggerStore();
        eventStore = new InMemoryEventStore();
        scheduler = new InMemoryJobScheduler(new Trigger4jProperties(), clock, Runnable::run);
        registry = new TriggerRegistry(triggerStore, eventStore, scheduler, clock);
    }

    @Test
    void scheduledTriggerShouldCreateOneEventPerFiring() {
        Trigger trigger = registry.createScheduled("u1", "half-hourly", "30");

        assertThat(trigger.id()).isNotNull();
        assertThat(scheduler.jobIds()).containsExactly("trigger_" + trigger.id());

        clock.advance(Duration.ofMinutes(30));
        scheduler.pollOnce();
        clock.advance(Duration.ofMinutes(30));
        scheduler.pollOnce();

        List<Event> events = eventStore.all();
        assertThat(events).hasSize(2);
        assertThat(events).allSatisfy(e -> {
            assertThat(e.triggerId()).isEqualTo(trigger.id());
            assertThat(e.ownerId()).isEqualTo("u1");
            assertThat(e.status()).isEqualTo(EventStatus.ACTIVE);
            assertThat(e.test()).isFalse();
            assertThat(e.payload()).isNull();
        });
        assertThat(events).extracting(Event::triggeredAt)
                .containsExactly(T0.plus(Duration.ofMinutes(30)), T0.plus(Duration.ofMinutes(60)));
    }

    @Test
    void malformedScheduleShouldPersistNothing() {
        assertThatThrownBy(() -> registry.createScheduled("u1", "bad", "every hour"))
                .isInstanceOf(ScheduleException.class);

        assertThat(triggerStore.size()).isZero();
        assertThat(scheduler.jobIds()).isEmpty();
    }

    @Test
    void invalidCronFieldShouldRollBackInsertedTrigger() {
        ScheduleException ex = catchThrowableOfType(
                () -> registry.createScheduled("u1", "bad", "0 25 * * *"), ScheduleException.class);

        assertThat(ex.reason()).isEqualTo(ScheduleException.Reason.INVALID_CRON_FIELD);
        assertThat(ex.kind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(triggerStore.size()).isZero();
        assertThat(scheduler.jobIds()).isEmpty();
    }

    @Test
    void apiTriggerShouldNotRegisterJob() {
        Trigger trigger = registry.createApi("u1", "payments", schema());

        assertThat(trigger.kind()).isEqualTo(TriggerKind.API);
        assertThat(trigger.apiSchema()).containsEntry("amount", FieldType.FLOAT).containsEntry("currency", FieldType.STRING);
        assertThat(scheduler.jobIds()).isEmpty();
    }

    @Test
    void apiTriggerWithUnknownTagShouldBeRejected() {
        ValidationException ex = catchThrowableOfType(
                () -> registry.createApi("u1", "bad", Map.of("when", "date")), ValidationException.class);

        assertThat(ex.reason()).isEqualTo(ValidationException.Reason.UNKNOWN_FIELD_TYPE);
        assertThat(triggerStore.size()).isZero();
    }

    @Test
    void testCallShouldValidatePayloadAgainstSchema() {
        Trigger trigger = registry.createApi("u1", "payments", schema());

        String eventId = registry.test("u1", trigger.id(), Map.of("amount", 12.5, "currency", "USD"));

        Event event = eventStore.findById(eventId).orElseThrow();
        assertThat(event.test()).isTrue();
        assertThat(event.status()).isEqualTo(EventStatus.ACTIVE);
        assertThat(event.payload()).containsEntry("currency", "USD");

        ValidationException ex = catchThrowableOfType(
                () -> registry.test("u1", trigger.id(), Map.of("amount", "12.5", "currency", "USD")),
                ValidationException.class);
        assertThat(ex.reason()).isEqualTo(ValidationException.Reason.TYPE_MISMATCH);
        assertThat(ex.field()).isEqualTo("amount");
        assertThat(ex.expected()).isEqualTo("float");
        assertThat(ex.actual()).isEqualTo("string");
        assertThat(eventStore.all()).hasSize(1);
    }

    @Test
    void emptyPayloadShouldSkipValidation() {
        Trigger trigger = registry.createApi("u1", "payments", schema());

        String eventId = registry.test("u1", trigger.id(), Map.of());

        assertThat(eventStore.findById(eventId)).isPresent();
    }

    @Test
    void testOfScheduledTriggerShouldCreateTestEvent() {
        Trigger trigger = registry.createScheduled("u1", "hourly", "0 * * * *");

        String eventId = registry.test("u1", trigger.id(), null);

        Event event = eventStore.findById(eventId).orElseThrow();
        assertThat(event.test()).isTrue();
        assertThat(event.triggerId()).isEqualTo(trigger.id());
        assertThat(event.triggeredAt()).isEqualTo(T0);
    }

    @Test
    void otherOwnersTriggerShouldBeNotFound() {
        Trigger trigger = registry.createApi("u1", "payments", schema());

        assertThatThrownBy(() -> registry.test("u2", trigger.id(), Map.of()))
                .isInstanceOf(TriggerNotFoundException.class);
        assertThatThrownBy(() -> registry.delete("u2", trigger.id()))
                .isInstanceOf(TriggerNotFoundException.class);
        assertThat(triggerStore.size()).isEqualTo(1);
    }

    @Test
    void deleteTwiceShouldSucceedThenBeNotFound() {
        Trigger trigger = registry.createScheduled("u1", "every-5", "5");

        registry.delete("u1", trigger.id());

        TriggerNotFoundException ex = catchThrowableOfType(
                () -> registry.delete("u1", trigger.id()), TriggerNotFoundException.class);
        assertThat(ex.kind()).isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    void deleteShouldCancelFutureFiringsAndKeepEvents() {
        Trigger trigger = registry.createScheduled("u1", "every-5", "5");
        clock.advance(Duration.ofMinutes(5));
        scheduler.pollOnce();
        assertThat(eventStore.all()).hasSize(1);

        registry.delete("u1", trigger.id());
        clock.advance(Duration.ofHours(1));
        scheduler.pollOnce();

        assertThat(scheduler.jobIds()).isEmpty();
        assertThat(eventStore.all()).hasSize(1);
        assertThat(eventStore.all().get(0).triggerId()).isEqualTo(trigger.id());
        assertThat(registry.list("u1")).isEmpty();
    }

    @Test
    void failedRowDeleteShouldRestoreJob() {
        Trigger trigger = registry.createScheduled("u1", "every-5", "5");
        triggerStore.failDeletes(true);

        assertThatThrownBy(() -> registry.delete("u1", trigger.id())).isInstanceOf(StoreException.class);

        assertThat(scheduler.jobIds()).containsExactly(trigger.jobId());
        assertThat(triggerStore.findById(trigger.id())).isPresent();
    }

    @Test
    void firingForDeletedTriggerShouldBeNoOp() {
        registry.fire("trigger_404");
        registry.fire("unrelated");

        assertThat(eventStore.all()).isEmpty();
    }

    @Test
    void listShouldReturnOwnTriggersInInsertionOrder() {
        Trigger a = registry.createScheduled("u1", "a", "5");
        registry.createApi("u2", "other", schema());
        Trigger b = registry.createApi("u1", "b", schema());

        assertThat(registry.list("u1")).extracting(Trigger::id).containsExactly(a.id(), b.id());
        assertThat(registry.list("nobody")).isEmpty();
    }

    @Test
    void reconcileShouldRegisterEveryPersistedScheduledTrigger() {
        Trigger every5 = triggerStore.insert(Trigger.scheduled("u1", "a", "5", T0));
        Trigger daily = triggerStore.insert(Trigger.scheduled("u2", "b", "0 9 * * *", T0));
        triggerStore.insert(Trigger.scheduled("u2", "broken", "0 99 * * *", T0));
        triggerStore.insert(Trigger.api("u1", "c", Map.of("x", FieldType.INT), T0));

        int registered = registry.reconcile();

        assertThat(registered).isEqualTo(2);
        assertThat(scheduler.jobIds()).containsExactlyInAnyOrder(every5.jobId(), daily.jobId());

        clock.advance(Duration.ofMinutes(5));
        scheduler.pollOnce();
        assertThat(eventStore.all()).extracting(Event::triggerId).containsExactly(every5.id());
    }

    private static Map<String, String> schema() {
        Map<String, String> schema = new LinkedHashMap<>();
        schema.put("amount", "float");
        schema.put("currency", "str");
        return schema;
    }
}
