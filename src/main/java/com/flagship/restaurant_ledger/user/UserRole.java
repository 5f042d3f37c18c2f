package com.flagship.restaurant_ledger.user;

import java.util.Arrays;
import java.util.Locale;

public enum UserRole {
    ADMIN,
    MANAGER,
    STAFF;

    /**
     * Unknown roles are treated as the least privileged one.
     */
    public static UserRole fromValue(String value) {
        if (value == null) {
            return STAFF;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(role -> role.name().equals(normalized))
                .findFirst()
                .orElse(STAFF);
    }
}
