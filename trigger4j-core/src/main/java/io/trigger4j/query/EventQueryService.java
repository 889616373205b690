package io.trigger4j.query;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trigger4j.cache.TtlCache;
import io.trigger4j.config.Trigger4jProperties;
import io.trigger4j.core.Event;
import io.trigger4j.core.EventQuery;
import io.trigger4j.core.ValidationException;
import io.trigger4j.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads of active and archived events. Active listings go through a short-lived cache keyed by
 * owner, filter and page; the cache is cleared as a whole whenever a sweep changes event states.
 */
public class EventQueryService {
    private static final Logger log = LoggerFactory.getLogger(EventQueryService.class);

    private static final TypeReference<List<Event>> EVENT_LIST = new TypeReference<>() {
    };

    private final EventStore eventStore;
    private final TtlCache cache;
    private final ObjectMapper objectMapper;
    private final Trigger4jProperties props;
    private final Clock clock;

    public EventQueryService(EventStore eventStore,
                             TtlCache cache,
                             ObjectMapper objectMapper,
                             Trigger4jProperties props,
                             Clock clock) {
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public List<Event> getRecent(String ownerId, EventQuery query) {
        requireOwner(ownerId);
        checkPageSize(query);

        String key = cacheKey(ownerId, query);
        Optional<List<Event>> cached = readCache(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        Instant since = clock.instant().minus(props.getArchiveAfter());
        List<Event> events = eventStore.findActiveSince(
                ownerId, query.includeTest(), since, query.offset(), query.pageSize());

        writeCache(key, events);
        return events;
    }

    public List<Event> getArchived(String ownerId, EventQuery query) {
        requireOwner(ownerId);
        checkPageSize(query);

        Instant now = clock.instant();
        return eventStore.findArchivedBetween(
                ownerId,
                query.includeTest(),
                now.minus(props.getDeleteAfter()),
                now.minus(props.getArchiveAfter()),
                query.offset(),
                query.pageSize());
    }

    /**
     * Drop every cached recent-events page of every owner.
     *
     * @return number of removed cache entries
     */
    public long invalidateRecent() {
        long removed = cache.deleteByPrefix(props.getRecentCachePrefix());
        log.debug("Recent events cache invalidated removed={}", removed);
        return removed;
    }

    String cacheKey(String ownerId, EventQuery query) {
        return props.getRecentCachePrefix() + ownerId + ":" + query.includeTest() + ":" + query.page() + ":" + query.pageSize();
    }

    private Optional<List<Event>> readCache(String key) {
        try {
            Optional<byte[]> bytes = cache.get(key);
            if (bytes.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(bytes.get(), EVENT_LIST));
        } catch (IOException | RuntimeException e) {
            log.warn("Recent events cache read failed key={} msg={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String key, List<Event> events) {
        try {
            cache.set(key, objectMapper.writeValueAsBytes(events), props.getRecentCacheTtl());
        } catch (IOException | RuntimeException e) {
            log.warn("Recent events cache write failed key={} msg={}", key, e.getMessage());
        }
    }

    private void checkPageSize(EventQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        if (query.pageSize() > props.getMaxPageSize()) {
            throw ValidationException.invalidArgument("pageSize must be <= " + props.getMaxPageSize());
        }
    }

    private static void requireOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw ValidationException.invalidArgument("ownerId must not be blank");
        }
    }
}
