package com.flagship.restaurant_ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for back-office domain events.
 *
 * Events are facts about committed changes and are only published once the
 * originating transaction has committed.
 */
public interface LedgerEvent {

    /**
     * Unique identifier for this event instance. Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * Event type name for routing/filtering, e.g. {@code purchase.created}.
     */
    String getEventType();

    @JsonIgnore
    String getAggregateType();

    @JsonIgnore
    String getAggregateId();

    Instant getOccurredAt();
}
