package com.flagship.restaurant_ledger.recurrence.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Partial rule update; null fields are left unchanged.
 */
@Value
@Builder
@Jacksonized
public class UpdateRecurrenceRuleRequest {
    String name;
    String description;
    String type;
    String category;
    String subcategory;
    BigDecimal value;
    String recurrenceType;
    Integer recurrenceDay;
    String senderReceiver;
    String notes;
    Boolean active;

    public boolean isEmpty() {
        return name == null && description == null && type == null && category == null
                && subcategory == null && value == null && recurrenceType == null
                && recurrenceDay == null && senderReceiver == null && notes == null && active == null;
    }
}
