package com.flagship.restaurant_ledger.event;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Published when a movement moves between Pending and Paid. Carries the
 * linked invoice when the change was synchronized to one.
 */
@Value
public class MovementPaymentStatusUpdatedEvent implements LedgerEvent {
    UUID eventId;
    Long movementId;
    String previousStatus;
    String newStatus;
    LocalDateTime movementDate;
    Long syncedInvoiceId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "financial_movement.payment_status_updated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "FinancialMovement";
    }

    @Override
    public String getAggregateId() {
        return String.valueOf(movementId);
    }

    public static MovementPaymentStatusUpdatedEvent of(Long movementId, String previousStatus, String newStatus,
                                                       LocalDateTime movementDate, Long syncedInvoiceId) {
        return new MovementPaymentStatusUpdatedEvent(UUID.randomUUID(), movementId, previousStatus,
                newStatus, movementDate, syncedInvoiceId, Instant.now());
    }
}
