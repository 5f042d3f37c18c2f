package com.flagship.restaurant_ledger.settlement.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class SettlementRequest {
    @NotNull(message = "INVALID_VALUE")
    @Positive(message = "INVALID_VALUE")
    BigDecimal orderTotal;

    String paymentMethod;
    String paymentDate;
}
