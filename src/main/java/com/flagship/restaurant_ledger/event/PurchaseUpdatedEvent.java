package com.flagship.restaurant_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class PurchaseUpdatedEvent implements LedgerEvent {
    UUID eventId;
    Long invoiceId;
    List<String> changedFields;
    BigDecimal totalAmount;
    String paymentStatus;
    Instant occurredAt;

    public static final String EVENT_TYPE = "purchase.updated";

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

    public static PurchaseUpdatedEvent of(Long invoiceId, List<String> changedFields,
                                          BigDecimal totalAmount, String paymentStatus) {
        return new PurchaseUpdatedEvent(UUID.randomUUID(), invoiceId, List.copyOf(changedFields),
                totalAmount, paymentStatus, Instant.now());
    }
}
