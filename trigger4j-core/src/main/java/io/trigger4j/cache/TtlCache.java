package io.trigger4j.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value cache with per-entry expiry. Best effort: never the source of truth.
 */
public interface TtlCache {

    Optional<byte[]> get(String key);

    void set(String key, byte[] value, Duration ttl);

    /**
     * Remove every entry whose key starts with {@code prefix}.
     *
     * @return number of removed entries
     */
    long deleteByPrefix(String prefix);
}
