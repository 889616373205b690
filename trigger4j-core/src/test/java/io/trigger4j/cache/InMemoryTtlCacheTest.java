package io.trigger4j.cache;

import io.trigger4j.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryTtlCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final InMemoryTtlCache cache = new InMemoryTtlCache(clock);

    @Test
    void entryShouldExpireAfterTtl() {
        cache.set("k", bytes("v"), Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(59));
        assertArrayEquals(bytes("v"), cache.get("k").orElseThrow());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get("k").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void expiredEntriesShouldBePurgedByLaterWrites() {
        cache.set("recent_events:u1:false:1:10", bytes("a"), Duration.ofSeconds(60));
        cache.set("recent_events:u2:false:1:10", bytes("b"), Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(61));
        cache.set("recent_events:u3:false:1:10", bytes("c"), Duration.ofSeconds(60));
        assertEquals(1, cache.size());

        cache.set("other:u1", bytes("d"), Duration.ofSeconds(120));
        clock.advance(Duration.ofSeconds(60));
        assertEquals(0, cache.deleteByPrefix("recent_events:"));
        assertEquals(1, cache.size());
    }

    @Test
    void storedBytesShouldNotBeAliased() {
        byte[] value = bytes("abc");
        cache.set("k", value, Duration.ofSeconds(60));
        value[0] = 'z';

        byte[] read = cache.get("k").orElseThrow();
        read[1] = 'z';

        assertArrayEquals(bytes("abc"), cache.get("k").orElseThrow());
    }

    @Test
    void deleteByPrefixShouldOnlyRemoveMatchingKeys() {
        cache.set("recent_events:u1:false:1:10", bytes("a"), Duration.ofSeconds(60));
        cache.set("recent_events:u2:true:2:5", bytes("b"), Duration.ofSeconds(60));
        cache.set("other:u1", bytes("c"), Duration.ofSeconds(60));

        assertEquals(2, cache.deleteByPrefix("recent_events:"));
        assertTrue(cache.get("recent_events:u1:false:1:10").isEmpty());
        assertTrue(cache.get("other:u1").isPresent());
    }

    @Test
    void nonPositiveTtlShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> cache.set("k", bytes("v"), Duration.ZERO));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
