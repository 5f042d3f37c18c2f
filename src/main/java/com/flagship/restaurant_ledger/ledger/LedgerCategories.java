package com.flagship.restaurant_ledger.ledger;

/**
 * Category and related-entity names the engine books automatically.
 */
public final class LedgerCategories {

    public static final String SALES = "Sales";
    public static final String VARIABLE_COSTS = "Variable Costs";
    public static final String FIXED_COSTS = "Fixed Costs";
    public static final String TAXES = "Taxes";
    public static final String STOCK_PURCHASES = "Stock Purchases";

    public static final String INGREDIENTS = "Ingredients";
    public static final String INGREDIENTS_CONSUMED = "Ingredients Consumed";
    public static final String PAYMENT_FEES = "Payment Fees";

    public static final String RELATED_PURCHASE_INVOICE = "purchase_invoice";
    public static final String RELATED_ORDER = "order";
    public static final String RELATED_RECURRENCE_RULE = "recurrence_rule";

    private LedgerCategories() {
    }
}
