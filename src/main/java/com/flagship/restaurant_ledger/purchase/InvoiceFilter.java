package com.flagship.restaurant_ledger.purchase;

import com.flagship.restaurant_ledger.ledger.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Optional criteria for listing invoices. Supplier name matches case-insensitively anywhere in the name.
 */
@Value
@Builder
public class InvoiceFilter {
    String supplierName;
    LocalDate startDate;
    LocalDate endDate;
    PaymentStatus paymentStatus;
}
