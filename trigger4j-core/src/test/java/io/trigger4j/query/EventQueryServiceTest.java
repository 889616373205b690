package io.trigger4j.query;

import io.trigger4j.cache.InMemoryTtlCache;
import io.trigger4j.cache.TtlCache;
import io.trigger4j.config.Trigger4jProperties;
import io.trigger4j.core.Event;
import io.trigger4j.core.EventQuery;
import io.trigger4j.core.FieldType;
import io.trigger4j.core.Trigger;
import io.trigger4j.core.ValidationException;
import io.trigger4j.support.InMemoryEventStore;
import io.trigger4j.support.MutableClock;
import io.trigger4j.utils.Trigger4jJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EventQueryServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private InMemoryEventStore eventStore;
    private InMemoryTtlCache cache;
    private EventQueryService service;
    private Trigger trigger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        eventStore = new InMemoryEventStore();
        cache = new InMemoryTtlCache(clock);
        service = new EventQueryService(eventStore, cache, Trigger4jJson.objectMapper(), new Trigger4jProperties(), clock);
        trigger = Trigger.api("u1", "payments", Map.of("amount", FieldType.FLOAT), NOW.minus(Duration.ofDays(3))).withId("t1");
    }

    @Test
    void recentShouldBeNewestFirstAndExcludeTestEventsByDefault() {
        Event older = eventStore.insert(Event.fired(trigger, NOW.minus(Duration.ofMinutes(90))));
        Event newer = eventStore.insert(Event.fired(trigger, NOW.minus(Duration.ofMinutes(10))));
        eventStore.insert(Event.forTest(trigger, Map.of("amount", 1.5), NOW.minus(Duration.ofMinutes(5))));
        eventStore.insert(Event.fired(trigger, NOW.minus(Duration.ofHours(3))));

        List<Event> recent = service.getRecent("u1", EventQuery.defaults());

        assertThat(recent).extracting(Event::id).containsExactly(newer.id(), older.id());
        assertThat(service.getRecent("u1", new EventQuery(true, 1, 10))).hasSize(3);
    }

    @Test
    void repeatedReadWithinTtlShouldBeServedFromCache() {
        eventStore.insert(Event.forTest(trigger, Map.of("amount", 12.5), NOW.minus(Duration.ofMinutes(1))));
        EventQuery query = new EventQuery(true, 1, 10);

        List<Event> first = service.getRecent("u1", query);
        byte[] cached = cache.get("recent_events:u1:true:1:10").orElseThrow();

        eventStore.insert(Event.fired(trigger, NOW));
        clock.advance(Duration.ofSeconds(30));
        List<Event> second = service.getRecent("u1", query);

        assertThat(second).isEqualTo(first);
        assertThat(cache.get("recent_events:u1:true:1:10").orElseThrow()).isEqualTo(cached);
        assertThat(new String(cached, StandardCharsets.UTF_8)).contains("\"triggeredAt\":\"2026-03-01T11:59:00Z\"");

        clock.advance(Duration.ofSeconds(30));
        assertThat(service.getRecent("u1", query)).hasSize(2);
    }

    @Test
    void invalidateShouldForceFreshQuery() {
        eventStore.insert(Event.fired(trigger, NOW.minus(Duration.ofMinutes(1))));
        assertThat(service.getRecent("u1", EventQuery.defaults())).hasSize(1);

        eventStore.insert(Event.fired(trigger, NOW));
        assertThat(service.getRecent("u1", EventQuery.defaults())).hasSize(1);

        assertThat(service.invalidateRecent()).isEqualTo(1);
        assertThat(service.getRecent("u1", EventQuery.defaults())).hasSize(2);
    }

    @Test
    void pagesShouldBeCachedIndependently() {
        for (int i = 0; i < 5; i++) {
            eventStore.insert(Event.fired(trigger, NOW.minus(Duration.ofMinutes(i))));
        }

        List<Event> page1 = service.getRecent("u1", new EventQuery(false, 1, 2));
        List<Event> page3 = service.getRecent("u1", new EventQuery(false, 3, 2));

        assertThat(page1).hasSize(2);
        assertThat(page3).hasSize(1);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void archivedShouldUseWindowBetweenThresholds() {
        Event inWindow = eventStore.put(Event.fired(trigger, NOW.minus(Duration.ofHours(10))).archive(NOW));
        eventStore.put(Event.fired(trigger, NOW.minus(Duration.ofHours(50))).archive(NOW));
        eventStore.insert(Event.fired(trigger, NOW.minus(Duration.ofHours(5))));

        List<Event> archived = service.getArchived("u1", EventQuery.defaults());

        assertThat(archived).extracting(Event::id).containsExactly(inWindow.id());
        assertThat(cache.size()).isZero();
    }

    @Test
    void otherOwnersShouldSeeNothing() {
        eventStore.insert(Event.fired(trigger, NOW));
        assertThat(service.getRecent("u2", EventQuery.defaults())).isEmpty();
    }

    @Test
    void pageFarBeyondDataShouldBeEmpty() {
        eventStore.insert(Event.fired(trigger, NOW));
        EventQuery query = new EventQuery(false, 300_000_000, 10);

        assertThat(query.offset()).isEqualTo(2_999_999_990L);
        assertThat(service.getRecent("u1", query)).isEmpty();
        assertThat(service.getArchived("u1", new EventQuery(false, Integer.MAX_VALUE, 100))).isEmpty();
    }

    @Test
    void pageSizeAboveMaximumShouldBeRejected() {
        assertThatThrownBy(() -> service.getRecent("u1", new EventQuery(false, 1, 101)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new EventQuery(false, 0, 10))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new EventQuery(false, 1, 0))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void cacheFailureShouldFallBackToStore() {
        TtlCache broken = mock(TtlCache.class);
        when(broken.get(anyString())).thenThrow(new IllegalStateException("cache down"));
        doThrow(new IllegalStateException("cache down")).when(broken).set(anyString(), any(), any());
        EventQueryService degraded = new EventQueryService(
                eventStore, broken, Trigger4jJson.objectMapper(), new Trigger4jProperties(), clock);
        eventStore.insert(Event.fired(trigger, NOW));

        assertThat(degraded.getRecent("u1", EventQuery.defaults())).hasSize(1);
    }

    @Test
    void undecodableCacheEntryShouldBeTreatedAsMiss() {
        eventStore.insert(Event.fired(trigger, NOW));
        cache.set("recent_events:u1:false:1:10", "not json".getBytes(StandardCharsets.UTF_8), Duration.ofSeconds(60));

        assertThat(service.getRecent("u1", EventQuery.defaults())).hasSize(1);
    }
}
