package com.flagship.restaurant_ledger.purchase;

import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;
import com.flagship.restaurant_ledger.user.UserDirectory;
import com.flagship.restaurant_ledger.user.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Decides who may change a purchase invoice.
 *
 * DELETE: admins only.
 * EDIT: admins, managers, or the user who registered the invoice.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InvoicePermissionGate {

    private final UserDirectory userDirectory;

    /**
     * @throws LedgerException PERMISSION_DENIED if the user is unknown or not allowed
     */
    public void check(PurchaseInvoice invoice, Long userId, InvoiceAction action) {
        UserRole role = userDirectory.getRole(userId)
                .orElseThrow(() -> deny(invoice, userId, action, "unknown user"));

        boolean allowed;
        switch (action) {
            case DELETE:
                allowed = role == UserRole.ADMIN;
                break;
            case EDIT:
                allowed = role == UserRole.ADMIN
                        || role == UserRole.MANAGER
                        || Objects.equals(invoice.getCreatedBy(), userId);
                break;
            default:
                allowed = false;
        }

        if (!allowed) {
            throw deny(invoice, userId, action, "role " + role);
        }
    }

    private LedgerException deny(PurchaseInvoice invoice, Long userId, InvoiceAction action, String reason) {
        log.warn("Denied {} on invoice {} for user {}: {}", action, invoice.getId(), userId, reason);
        return new LedgerException(ErrorCode.PERMISSION_DENIED,
                "User " + userId + " is not allowed to " + action.name().toLowerCase() + " invoice " + invoice.getId());
    }
}
