package com.flagship.restaurant_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Typed input for recording a movement. Built by the REST layer from a
 * request and by the invoice, settlement and recurrence flows directly.
 */
@Value
@Builder(toBuilder = true)
public class NewMovement {
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
}
