package com.flagship.restaurant_ledger.common;

import org.springframework.util.StringUtils;

/**
 * Normalization of optional text fields coming from requests and filters.
 */
public final class Strings {

    private Strings() {
    }

    /**
     * Trimmed value, or null when the input is null or blank.
     */
    public static String blankToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
