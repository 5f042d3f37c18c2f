package com.flagship.restaurant_ledger.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed ledger cache storing JSON values.
 *
 * Redis being unavailable is not an error: reads fall through to the
 * database and writes are skipped with a warning.
 */
@Component
@ConditionalOnProperty(name = "ledger.cache.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class RedisLedgerCache implements LedgerCache {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisLedgerCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> Optional<T> get(String key, TypeReference<T> type) {
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json == null) {
                return Optional.empty();
            }
            log.debug("Cache hit: {}", key);
            return Optional.of(objectMapper.readValue(json, type));
        } catch (Exception e) {
            log.warn("Cache read failed for {}. Falling back to database. Error: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(value), ttl);
        } catch (Exception e) {
            log.warn("Cache write failed for {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void invalidatePrefix(String prefix) {
        try {
            List<String> keys = new ArrayList<>();
            ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(500).build();
            try (Cursor<String> cursor = redisTemplate.scan(options)) {
                cursor.forEachRemaining(keys::add);
            }
            if (!keys.isEmpty()) {
                redisTemplate.delete(keys);
                log.debug("Invalidated {} cache keys with prefix {}", keys.size(), prefix);
            }
        } catch (Exception e) {
            log.warn("Cache invalidation failed for prefix {}: {}", prefix, e.getMessage());
        }
    }

    @Override
    public Status status() {
        try {
            String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(reply) ? Status.UP : Status.DEGRADED;
        } catch (Exception e) {
            log.debug("Redis ping failed: {}", e.getMessage());
            return Status.DEGRADED;
        }
    }
}
