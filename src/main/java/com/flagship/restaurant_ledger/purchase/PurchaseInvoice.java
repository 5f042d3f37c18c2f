package com.flagship.restaurant_ledger.purchase;

import com.flagship.restaurant_ledger.ledger.PaymentStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * A supplier invoice that added stock.
 *
 * Invariants:
 * - totalAmount equals the sum of item totalPrice
 * - exactly one EXPENSE movement is linked to it (expenseId)
 * - a PAID invoice has a paymentDate
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PurchaseInvoice {
    Long id;
    String invoiceNumber;
    String supplierName;
    BigDecimal totalAmount;
    LocalDateTime purchaseDate;
    PaymentStatus paymentStatus;
    String paymentMethod;
    LocalDateTime paymentDate;
    String notes;
    Long createdBy;
    String createdByName;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
    List<PurchaseInvoiceItem> items;
    Long expenseId;
}
