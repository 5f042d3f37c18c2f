package com.flagship.restaurant_ledger.recurrence;

import com.flagship.restaurant_ledger.common.tx.TransactionContext;
import com.flagship.restaurant_ledger.ledger.MovementType;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * SQL access to {@code recurrence_rules}.
 */
@Repository
public class RecurrenceRuleRepository {

    private static final RowMapper<RecurrenceRule> RULE_MAPPER = (rs, rowNum) -> RecurrenceRule.builder()
            .id(rs.getLong("id"))
            .name(rs.getString("name"))
            .description(rs.getString("description"))
            .type(MovementType.parse(rs.getString("type")))
            .category(rs.getString("category"))
            .subcategory(rs.getString("subcategory"))
            .value(rs.getBigDecimal("value"))
            .recurrenceType(RecurrenceType.parse(rs.getString("recurrence_type")))
            .recurrenceDay(rs.getInt("recurrence_day"))
            .senderReceiver(rs.getString("sender_receiver"))
            .notes(rs.getString("notes"))
            .active(rs.getBoolean("is_active"))
            .createdBy(rs.getObject("created_by", Long.class))
            .createdAt(rs.getObject("created_at", LocalDateTime.class))
            .updatedAt(rs.getObject("updated_at", LocalDateTime.class))
            .build();

    public long insert(RecurrenceRule rule, Long userId, TransactionContext tx) {
        return tx.jdbc().queryForObject("""
                INSERT INTO recurrence_rules (
                    name, description, type, category, subcategory, value, recurrence_type,
                    recurrence_day, sender_receiver, notes, is_active, created_by, created_at, updated_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, TRUE, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
                RETURNING id
                """, Long.class,
                rule.getName(),
                rule.getDescription(),
                rule.getType().name(),
                rule.getCategory(),
                rule.getSubcategory(),
                rule.getValue(),
                rule.getRecurrenceType().name(),
                rule.getRecurrenceDay(),
                rule.getSenderReceiver(),
                rule.getNotes(),
                userId);
    }

    public Optional<RecurrenceRule> findById(long id, TransactionContext tx) {
        return tx.jdbc().query("SELECT * FROM recurrence_rules WHERE id = ?", RULE_MAPPER, id)
                .stream()
                .findFirst();
    }

    public Optional<RecurrenceRule> findByIdForUpdate(long id, TransactionContext tx) {
        return tx.jdbc().query("SELECT * FROM recurrence_rules WHERE id = ? FOR UPDATE", RULE_MAPPER, id)
                .stream()
                .findFirst();
    }

    public List<RecurrenceRule> findAll(boolean activeOnly, TransactionContext tx) {
        String where = activeOnly ? " WHERE is_active = TRUE" : "";
        return tx.jdbc().query("SELECT * FROM recurrence_rules" + where + " ORDER BY name, id", RULE_MAPPER);
    }

    /**
     * Writes every mutable field of the rule.
     */
    public int update(RecurrenceRule rule, TransactionContext tx) {
        return tx.jdbc().update("""
                UPDATE recurrence_rules
                SET name = ?, description = ?, type = ?, category = ?, subcategory = ?, value = ?,
                    recurrence_type = ?, recurrence_day = ?, sender_receiver = ?, notes = ?, is_active = ?,
                    updated_at = CURRENT_TIMESTAMP
                WHERE id = ?
                """,
                rule.getName(),
                rule.getDescription(),
                rule.getType().name(),
                rule.getCategory(),
                rule.getSubcategory(),
                rule.getValue(),
                rule.getRecurrenceType().name(),
                rule.getRecurrenceDay(),
                rule.getSenderReceiver(),
                rule.getNotes(),
                rule.isActive(),
                rule.getId());
    }

    public int deactivate(long id, TransactionContext tx) {
        return tx.jdbc().update(
                "UPDATE recurrence_rules SET is_active = FALSE, updated_at = CURRENT_TIMESTAMP WHERE id = ?", id);
    }
}
