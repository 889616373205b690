package io.trigger4j.internal.redis;

import io.trigger4j.cache.TtlCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.serializer.RedisSerializer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TtlCache} over Redis string values. Expiry is left to Redis ({@code SET ... PX}).
 *
 * <p>Prefix deletion walks the keyspace with {@code SCAN MATCH prefix*} and deletes in batches,
 * so it never blocks the server the way {@code KEYS} would. Keys written concurrently with a
 * deletion may survive it.
 */
public class RedisTtlCache implements TtlCache {
    private static final Logger log = LoggerFactory.getLogger(RedisTtlCache.class);

    static final int SCAN_BATCH = 500;

    private final RedisTemplate<String, byte[]> redisTemplate;

    public RedisTtlCache(RedisTemplate<String, byte[]> redisTemplate) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate must not be null");
    }

    /**
     * Build a cache with string keys and raw byte values over the given connection factory.
     */
    public static RedisTtlCache create(RedisConnectionFactory connectionFactory) {
        Objects.requireNonNull(connectionFactory, "connectionFactory must not be null");

        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(RedisSerializer.string());
        template.setValueSerializer(RedisSerializer.byteArray());
        template.afterPropertiesSet();
        return new RedisTtlCache(template);
    }

    @Override
    public Optional<byte[]> get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be a positive duration");
        }
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public long deleteByPrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");

        ScanOptions options = ScanOptions.scanOptions()
                .match(escapeGlob(prefix) + "*")
                .count(SCAN_BATCH)
                .build();

        long removed = 0;
        List<String> batch = new ArrayList<>(SCAN_BATCH);
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() >= SCAN_BATCH) {
                    removed += deleteBatch(batch);
                }
            }
        }
        removed += deleteBatch(batch);

        log.debug("Redis cache prefix delete prefix={} removed={}", prefix, removed);
        return removed;
    }

    private long deleteBatch(List<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        Long deleted = redisTemplate.delete(keys);
        keys.clear();
        return deleted == null ? 0 : deleted;
    }

    static String escapeGlob(String prefix) {
        StringBuilder sb = new StringBuilder(prefix.length() + 4);
        for (char c : prefix.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
