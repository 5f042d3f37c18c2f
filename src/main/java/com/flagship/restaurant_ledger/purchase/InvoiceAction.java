package com.flagship.restaurant_ledger.purchase;

public enum InvoiceAction {
    EDIT,
    DELETE
}
