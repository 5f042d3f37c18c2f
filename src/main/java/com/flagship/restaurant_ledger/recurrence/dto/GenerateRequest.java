package com.flagship.restaurant_ledger.recurrence.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Period to generate; absent fields default to the current date.
 */
@Value
@Builder
@Jacksonized
public class GenerateRequest {
    Integer year;
    Integer month;
    Integer week;
}
