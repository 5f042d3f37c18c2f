package com.flagship.restaurant_ledger.ledger;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A persisted money movement.
 *
 * Invariants:
 * - value is strictly positive
 * - a PAID movement has a movementDate; a PENDING one may carry the expected date or none
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FinancialMovement {
    Long id;
    MovementType type;
    BigDecimal value;
    String category;
    String subcategory;
    String description;
    LocalDateTime movementDate;
    PaymentStatus paymentStatus;
    String paymentMethod;
    String senderReceiver;
    String relatedEntityType;
    Long relatedEntityId;
    String recurrencePeriodKey;
    String notes;
    String paymentGatewayId;
    String transactionId;
    String bankAccount;
    boolean reconciled;
    LocalDateTime reconciledAt;
    Long createdBy;
    String createdByName;
    Long updatedBy;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;

    public boolean isLinkedTo(String entityType) {
        return entityType.equals(relatedEntityType) && relatedEntityId != null;
    }
}
