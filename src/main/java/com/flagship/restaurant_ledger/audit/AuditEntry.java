package com.flagship.restaurant_ledger.audit;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One append-only record of a change to a purchase invoice.
 */
@Value
@Builder
public class AuditEntry {
    Long id;
    Long invoiceId;
    AuditAction actionType;
    Long changedBy;
    JsonNode oldValues;
    JsonNode newValues;
    List<String> changedFields;
    String notes;
    LocalDateTime createdAt;
}
