package com.flagship.restaurant_ledger.settlement;

import java.util.Locale;
import java.util.Map;

/**
 * Revenue subcategory for a payment method.
 */
public final class PaymentMethodLabels {

    private static final Map<String, String> LABELS = Map.of(
            "credit", "Credit Card",
            "debit", "Debit Card",
            "pix", "PIX",
            "money", "Cash",
            "cash", "Cash"
    );

    private PaymentMethodLabels() {
    }

    public static String subcategoryFor(String paymentMethod) {
        if (paymentMethod == null || paymentMethod.isBlank()) {
            return "Others";
        }
        return LABELS.getOrDefault(paymentMethod.trim().toLowerCase(Locale.ROOT), paymentMethod.trim());
    }
}
