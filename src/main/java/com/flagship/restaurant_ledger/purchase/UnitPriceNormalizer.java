package com.flagship.restaurant_ledger.purchase;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Cleans up unit prices coming from clients that compute them in floating point.
 *
 * The price is first cut to 10 decimals and stripped of trailing zeros;
 * only if more than 2 decimals remain is it rounded HALF_UP to cents.
 * {@code 39.9000000001} becomes {@code 39.9}, {@code 39.99} is kept.
 */
public final class UnitPriceNormalizer {

    private static final int WORKING_SCALE = 10;
    private static final int MONEY_SCALE = 2;

    private UnitPriceNormalizer() {
    }

    public static BigDecimal normalize(BigDecimal unitPrice) {
        if (unitPrice == null) {
            return null;
        }
        BigDecimal normalized = unitPrice.setScale(WORKING_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
        if (normalized.scale() > MONEY_SCALE) {
            normalized = normalized.setScale(MONEY_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
        }
        if (normalized.scale() < 0) {
            normalized = normalized.setScale(0);
        }
        return normalized;
    }
}
