package com.flagship.restaurant_ledger.purchase.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

/**
 * Request body for registering a supplier invoice. {@code totalAmount} is
 * informational: the stored total is always the sum of the line totals.
 */
@Value
@Builder
@Jacksonized
public class CreateInvoiceRequest {
    @NotBlank(message = "INVALID_INVOICE_NUMBER")
    String invoiceNumber;

    @NotBlank(message = "INVALID_SUPPLIER_NAME")
    String supplierName;

    String purchaseDate;
    String paymentStatus;
    String paymentMethod;
    String paymentDate;
    String notes;
    BigDecimal totalAmount;

    @NotEmpty(message = "INVALID_ITEMS")
    @Valid
    List<InvoiceItemRequest> items;
}
