package com.flagship.restaurant_ledger.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache used when {@code ledger.cache.enabled=false}; every read misses.
 */
@Component
@ConditionalOnProperty(name = "ledger.cache.enabled", havingValue = "false")
public class NoOpLedgerCache implements LedgerCache {

    @Override
    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return Optional.empty();
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
    }

    @Override
    public void invalidatePrefix(String prefix) {
    }

    @Override
    public Status status() {
        return Status.DISABLED;
    }
}
