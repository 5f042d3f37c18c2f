package com.flagship.restaurant_ledger.recurrence.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class CreateRecurrenceRuleRequest {
    @NotBlank(message = "INVALID_NAME")
    String name;

    String description;

    @NotBlank(message = "INVALID_TYPE")
    String type;

    String category;
    String subcategory;

    @NotNull(message = "INVALID_VALUE")
    @Positive(message = "INVALID_VALUE")
    BigDecimal value;

    @NotBlank(message = "INVALID_RECURRENCE_TYPE")
    String recurrenceType;

    @NotNull(message = "INVALID_RECURRENCE_DAY")
    Integer recurrenceDay;

    String senderReceiver;
    String notes;
}
