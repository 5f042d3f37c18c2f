package com.flagship.restaurant_ledger.purchase.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * An invoice line as entered. {@code quantity} is in the stock unit (e.g. g);
 * {@code displayQuantity} is the amount in the unit the price refers to (e.g. kg).
 */
@Value
@Builder
@Jacksonized
public class InvoiceItemRequest {
    @NotNull(message = "INVALID_ITEM")
    Long ingredientId;

    @NotNull(message = "INVALID_ITEM")
    @Positive(message = "INVALID_ITEM")
    BigDecimal quantity;

    @NotNull(message = "INVALID_ITEM")
    @Positive(message = "INVALID_ITEM")
    BigDecimal unitPrice;

    @Positive(message = "INVALID_TOTAL_PRICE")
    BigDecimal totalPrice;

    BigDecimal displayQuantity;
}
