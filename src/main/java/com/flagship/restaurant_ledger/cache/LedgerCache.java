package com.flagship.restaurant_ledger.cache;

import com.fasterxml.jackson.core.type.TypeReference;

import java.time.Duration;
import java.util.Optional;

/**
 * Read-through cache for ledger queries. Purely an optimization: every
 * implementation must treat its own failures as a miss.
 */
public interface LedgerCache {

    String MOVEMENTS_PREFIX = "ledger:movements:";
    String CASH_FLOW_PREFIX = "ledger:cashflow:";

    <T> Optional<T> get(String key, TypeReference<T> type);

    void put(String key, Object value, Duration ttl);

    void invalidatePrefix(String prefix);

    /**
     * Reachability of the backing store. Never throws.
     */
    Status status();

    /**
     * Drops every cached ledger read. Called after any committed movement change.
     */
    default void invalidateLedger() {
        invalidatePrefix(MOVEMENTS_PREFIX);
        invalidatePrefix(CASH_FLOW_PREFIX);
    }

    enum Status {
        UP,
        /** Backing store unreachable; reads go to the database. */
        DEGRADED,
        DISABLED
    }
}
