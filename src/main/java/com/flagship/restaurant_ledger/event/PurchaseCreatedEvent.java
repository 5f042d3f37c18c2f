package com.flagship.restaurant_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PurchaseCreatedEvent implements LedgerEvent {
    UUID eventId;
    Long invoiceId;
    String invoiceNumber;
    String supplierName;
    BigDecimal totalAmount;
    int itemCount;
    Long expenseId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "purchase.created";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "PurchaseInvoice";
    }

    @Override
    public String getAggregateId() {
        return String.valueOf(invoiceId);
    }

    public static PurchaseCreatedEvent of(Long invoiceId, String invoiceNumber, String supplierName,
                                          BigDecimal totalAmount, int itemCount, Long expenseId) {
        return new PurchaseCreatedEvent(UUID.randomUUID(), invoiceId, invoiceNumber, supplierName,
                totalAmount, itemCount, expenseId, Instant.now());
    }
}
