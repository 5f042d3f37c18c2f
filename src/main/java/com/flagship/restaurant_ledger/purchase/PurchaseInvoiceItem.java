package com.flagship.restaurant_ledger.purchase;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * One invoice line. {@code quantity} is in the ingredient's stock unit and is
 * what the line adds to stock; {@code unitPrice} is per display unit and
 * {@code totalPrice} is the exact amount charged by the supplier.
 */
@Value
@Builder
@Jacksonized
public class PurchaseInvoiceItem {
    Long id;
    Long ingredientId;
    String ingredientName;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal totalPrice;
}
