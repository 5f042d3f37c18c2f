package com.flagship.restaurant_ledger.recurrence;

import com.flagship.restaurant_ledger.ledger.MovementType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class RecurrenceRule {
    Long id;
    String name;
    String description;
    MovementType type;
    String category;
    String subcategory;
    BigDecimal value;
    RecurrenceType recurrenceType;
    Integer recurrenceDay;
    String senderReceiver;
    String notes;
    boolean active;
    Long createdBy;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
}
