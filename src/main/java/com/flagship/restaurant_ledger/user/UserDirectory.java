package com.flagship.restaurant_ledger.user;

import java.util.Optional;

/**
 * Lookup of back-office users owned by the authentication module.
 */
public interface UserDirectory {

    Optional<UserRole> getRole(Long userId);
}
