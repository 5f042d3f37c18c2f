package com.flagship.restaurant_ledger.ledger.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Partial update of a movement; absent (null) fields are left unchanged.
 */
@Value
@Builder
@Jacksonized
public class UpdateMovementRequest {
    String type;
    BigDecimal value;
    String category;
    String subcategory;
    String description;
    String movementDate;
    String paymentStatus;
    String paymentMethod;
    String senderReceiver;
    String notes;
}
