package com.flagship.restaurant_ledger.purchase.dto;

import lombok.Value;

import java.util.List;

@Value
public class InvoiceDeletion {
    Long invoiceId;
    Long deletedExpenseId;
    List<Long> restoredIngredientIds;
    boolean auditRecorded;
}
