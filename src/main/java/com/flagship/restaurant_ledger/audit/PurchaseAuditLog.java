package com.flagship.restaurant_ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.restaurant_ledger.common.tx.TransactionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * Audit trail of purchase invoice changes.
 *
 * Entries are written in the caller's transaction inside a savepoint. A
 * failed write is rolled back to the savepoint and logged; the invoice
 * operation itself carries on.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PurchaseAuditLog {

    private final ObjectMapper objectMapper;

    private final RowMapper<AuditEntry> entryMapper = this::mapEntry;

    /**
     * @return true if the entry was written
     */
    public boolean record(long invoiceId, AuditAction action, Long changedBy, Object oldValues,
                          Object newValues, List<String> changedFields, String notes, TransactionContext tx) {
        try {
            String oldJson = toJson(oldValues);
            String newJson = toJson(newValues);
            String fields = changedFields == null || changedFields.isEmpty() ? null : String.join(",", changedFields);

            tx.savepoint(() -> tx.jdbc().update("""
                    INSERT INTO purchase_invoice_audit (
                        invoice_id, action_type, changed_by, old_values, new_values, changed_fields, notes, created_at
                    ) VALUES (?, ?, ?, CAST(? AS jsonb), CAST(? AS jsonb), ?, ?, CURRENT_TIMESTAMP)
                    """, invoiceId, action.name(), changedBy, oldJson, newJson, fields, notes));
            return true;
        } catch (RuntimeException e) {
            log.warn("Audit entry {} for invoice {} was not recorded: {}", action, invoiceId, e.getMessage());
            return false;
        }
    }

    public List<AuditEntry> findByInvoice(long invoiceId, TransactionContext tx) {
        return tx.jdbc().query("""
                SELECT id, invoice_id, action_type, changed_by, old_values::text AS old_values,
                       new_values::text AS new_values, changed_fields, notes, created_at
                FROM purchase_invoice_audit
                WHERE invoice_id = ?
                ORDER BY created_at DESC, id DESC
                """, entryMapper, invoiceId);
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Audit snapshot is not serializable", e);
        }
    }

    private JsonNode fromJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable audit snapshot: {}", e.getMessage());
            return null;
        }
    }

    private AuditEntry mapEntry(ResultSet rs, int rowNum) throws SQLException {
        String fields = rs.getString("changed_fields");
        return AuditEntry.builder()
                .id(rs.getLong("id"))
                .invoiceId(rs.getLong("invoice_id"))
                .actionType(AuditAction.valueOf(rs.getString("action_type")))
                .changedBy(rs.getObject("changed_by", Long.class))
                .oldValues(fromJson(rs.getString("old_values")))
                .newValues(fromJson(rs.getString("new_values")))
                .changedFields(fields == null ? List.of() : Arrays.asList(fields.split(",")))
                .notes(rs.getString("notes"))
                .createdAt(rs.getObject("created_at", LocalDateTime.class))
                .build();
    }
}
