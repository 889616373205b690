package io.trigger4j.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link TtlCache}. Expired entries are dropped on read and purged on every write.
 */
public class InMemoryTtlCache implements TtlCache {

    private record Entry(byte[] value, Instant expiresAt) {
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTtlCache(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<byte[]> get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(Arrays.copyOf(entry.value(), entry.value().length));
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be a positive duration");
        }
        Instant now = clock.instant();
        purgeExpired(now);
        entries.put(key, new Entry(Arrays.copyOf(value, value.length), now.plus(ttl)));
    }

    @Override
    public long deleteByPrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        purgeExpired(clock.instant());
        long removed = 0;
        for (String key : entries.keySet()) {
            if (key.startsWith(prefix) && entries.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    private void purgeExpired(Instant now) {
        entries.values().removeIf(entry -> !now.isBefore(entry.expiresAt()));
    }

    public int size() {
        return entries.size();
    }
}
