package com.flagship.restaurant_ledger.purchase.dto;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Why an ingredient blocks reversing an invoice: its stock is below what the invoice added.
 */
@Value
public class StockShortage {
    Long ingredientId;
    String ingredientName;
    BigDecimal currentStock;
    BigDecimal requiredReversal;
    BigDecimal shortage;
}
