package com.flagship.restaurant_ledger.audit;

public enum AuditAction {
    CREATE,
    UPDATE,
    DELETE
}
