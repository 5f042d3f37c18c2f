package com.flagship.restaurant_ledger.purchase.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Partial invoice update. Supplying {@code items} replaces every line and
 * re-applies stock; null fields are left unchanged.
 */
@Value
@Builder
@Jacksonized
public class UpdateInvoiceRequest {
    String paymentStatus;
    String paymentMethod;
    String paymentDate;
    String notes;
    List<InvoiceItemRequest> items;

    public boolean isEmpty() {
        return paymentStatus == null && paymentMethod == null && paymentDate == null
                && notes == null && (items == null || items.isEmpty());
    }
}
