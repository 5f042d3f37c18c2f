package com.flagship.restaurant_ledger.event;

import com.flagship.restaurant_ledger.ledger.FinancialMovement;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

@Value
public class MovementCreatedEvent implements LedgerEvent {
    UUID eventId;
    Long movementId;
    String type;
    BigDecimal value;
    String category;
    String paymentStatus;
    LocalDateTime movementDate;
    String relatedEntityType;
    Long relatedEntityId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "financial_movement.created";

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

    public static MovementCreatedEvent from(FinancialMovement movement) {
        return new MovementCreatedEvent(
                UUID.randomUUID(),
                movement.getId(),
                movement.getType().name(),
                movement.getValue(),
                movement.getCategory(),
                movement.getPaymentStatus().getLabel(),
                movement.getMovementDate(),
                movement.getRelatedEntityType(),
                movement.getRelatedEntityId(),
                Instant.now()
        );
    }
}
