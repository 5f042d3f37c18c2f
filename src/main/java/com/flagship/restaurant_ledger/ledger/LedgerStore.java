package com.flagship.restaurant_ledger.ledger;

import com.flagship.restaurant_ledger.common.PageResult;
import com.flagship.restaurant_ledger.common.tx.TransactionContext;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * SQL access to {@code financial_movements}.
 *
 * Every method runs on the caller's {@link TransactionContext}; the store
 * never opens or commits a transaction itself.
 */
@Repository
public class LedgerStore {

    private static final String SELECT_MOVEMENT = """
        SELECT fm.*, u.full_name AS created_by_name
        FROM financial_movements fm
        LEFT JOIN users u ON u.id = fm.created_by
        """;

    private static final String INSERT_MOVEMENT = """
        INSERT INTO financial_movements (
            type, value, category, subcategory, description, movement_date,
            payment_status, payment_method, sender_receiver, related_entity_type,
            related_entity_id, recurrence_period_key, notes, payment_gateway_id,
            transaction_id, bank_account, created_by, created_at, updated_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
        """;

    private static final Set<String> UPDATABLE_COLUMNS = Set.of(
            "type", "value", "category", "subcategory", "description", "movement_date",
            "payment_status", "payment_method", "sender_receiver", "notes",
            "payment_gateway_id", "transaction_id", "bank_account");

    private static final RowMapper<FinancialMovement> MOVEMENT_MAPPER = LedgerStore::mapMovement;

    /**
     * Inserts a movement and returns its generated id.
     */
    public long insert(NewMovement movement, Long userId, TransactionContext tx) {
        Long id = tx.jdbc().queryForObject(INSERT_MOVEMENT + " RETURNING id", Long.class,
                insertArgs(movement, userId));
        return id;
    }

    /**
     * Inserts a recurrence-generated movement unless its rule already has one
     * for the same period.
     *
     * @return the new id, or empty when the period was already generated
     */
    public Optional<Long> insertRecurring(NewMovement movement, Long userId, TransactionContext tx) {
        List<Long> ids = tx.jdbc().queryForList(INSERT_MOVEMENT + """
                ON CONFLICT (related_entity_id, recurrence_period_key)
                    WHERE related_entity_type = 'recurrence_rule'
                DO NOTHING
                RETURNING id
                """, Long.class, insertArgs(movement, userId));
        return ids.stream().findFirst();
    }

    public Optional<FinancialMovement> findById(long id, TransactionContext tx) {
        return tx.jdbc().query(SELECT_MOVEMENT + " WHERE fm.id = ?", MOVEMENT_MAPPER, id)
                .stream()
                .findFirst();
    }

    /**
     * Loads a movement and locks its row until the transaction ends.
     */
    public Optional<FinancialMovement> findByIdForUpdate(long id, TransactionContext tx) {
        return tx.jdbc().query(SELECT_MOVEMENT + " WHERE fm.id = ? FOR UPDATE OF fm", MOVEMENT_MAPPER, id)
                .stream()
                .findFirst();
    }

    public Optional<FinancialMovement> findRelated(MovementType type, String relatedEntityType,
                                                   long relatedEntityId, TransactionContext tx) {
        return tx.jdbc().query(SELECT_MOVEMENT + """
                WHERE fm.type = ? AND fm.related_entity_type = ? AND fm.related_entity_id = ?
                ORDER BY fm.id
                """, MOVEMENT_MAPPER, type.name(), relatedEntityType, relatedEntityId)
                .stream()
                .findFirst();
    }

    public PageResult<FinancialMovement> find(MovementFilter filter, int page, int pageSize, TransactionContext tx) {
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        if (filter.getStartDate() != null) {
            conditions.add("fm.movement_date >= ?");
            params.add(filter.getStartDate().atStartOfDay());
        }
        if (filter.getEndDate() != null) {
            conditions.add("fm.movement_date < ?");
            params.add(filter.getEndDate().plusDays(1).atStartOfDay());
        }
        if (filter.getType() != null) {
            conditions.add("fm.type = ?");
            params.add(filter.getType().name());
        }
        if (filter.getCategory() != null) {
            conditions.add("fm.category = ?");
            params.add(filter.getCategory());
        }
        if (filter.getPaymentStatus() != null) {
            conditions.add("fm.payment_status = ?");
            params.add(filter.getPaymentStatus().getLabel());
        }
        if (filter.getRelatedEntityType() != null) {
            conditions.add("fm.related_entity_type = ?");
            params.add(filter.getRelatedEntityType());
        }
        if (filter.getRelatedEntityId() != null) {
            conditions.add("fm.related_entity_id = ?");
            params.add(filter.getRelatedEntityId());
        }
        if (filter.getPaymentGatewayId() != null) {
            conditions.add("fm.payment_gateway_id = ?");
            params.add(filter.getPaymentGatewayId());
        }
        if (filter.getTransactionId() != null) {
            conditions.add("fm.transaction_id = ?");
            params.add(filter.getTransactionId());
        }
        if (filter.getBankAccount() != null) {
            conditions.add("fm.bank_account = ?");
            params.add(filter.getBankAccount());
        }
        if (filter.getReconciled() != null) {
            conditions.add("fm.reconciled = ?");
            params.add(filter.getReconciled());
        }

        String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);

        Long total = tx.jdbc().queryForObject(
                "SELECT COUNT(*) FROM financial_movements fm" + where, Long.class, params.toArray());

        List<Object> pageParams = new ArrayList<>(params);
        pageParams.add(pageSize);
        pageParams.add((long) (page - 1) * pageSize);

        List<FinancialMovement> items = tx.jdbc().query(SELECT_MOVEMENT + where
                        + " ORDER BY fm.movement_date DESC NULLS LAST, fm.created_at DESC, fm.id DESC"
                        + " LIMIT ? OFFSET ?",
                MOVEMENT_MAPPER, pageParams.toArray());

        return PageResult.of(items, page, pageSize, total == null ? 0 : total);
    }

    /**
     * Applies a partial update. Keys are column names from a fixed whitelist.
     *
     * @return number of rows updated
     */
    public int update(long id, Map<String, Object> columns, Long userId, TransactionContext tx) {
        List<String> assignments = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        for (Map.Entry<String, Object> column : columns.entrySet()) {
            if (!UPDATABLE_COLUMNS.contains(column.getKey())) {
                throw new IllegalArgumentException("Column is not updatable: " + column.getKey());
            }
            assignments.add(column.getKey() + " = ?");
            params.add(column.getValue());
        }
        assignments.add("updated_by = ?");
        params.add(userId);
        assignments.add("updated_at = CURRENT_TIMESTAMP");
        params.add(id);

        return tx.jdbc().update(
                "UPDATE financial_movements SET " + String.join(", ", assignments) + " WHERE id = ?",
                params.toArray());
    }

    public int updatePaymentStatus(long id, PaymentStatus status, LocalDateTime movementDate,
                                   Long userId, TransactionContext tx) {
        return tx.jdbc().update("""
                UPDATE financial_movements
                SET payment_status = ?, movement_date = ?, updated_by = ?, updated_at = CURRENT_TIMESTAMP
                WHERE id = ?
                """, status.getLabel(), movementDate, userId, id);
    }

    public int updateReconciliation(long id, boolean reconciled, LocalDateTime reconciledAt, TransactionContext tx) {
        return tx.jdbc().update("""
                UPDATE financial_movements
                SET reconciled = ?, reconciled_at = ?, updated_at = CURRENT_TIMESTAMP
                WHERE id = ?
                """, reconciled, reconciledAt, id);
    }

    public int delete(long id, TransactionContext tx) {
        return tx.jdbc().update("DELETE FROM financial_movements WHERE id = ?", id);
    }

    public int deleteRelated(MovementType type, String relatedEntityType, long relatedEntityId,
                             TransactionContext tx) {
        return tx.jdbc().update("""
                DELETE FROM financial_movements
                WHERE type = ? AND related_entity_type = ? AND related_entity_id = ?
                """, type.name(), relatedEntityType, relatedEntityId);
    }

    /**
     * Sums PAID movements with a date in {@code [start, end)} per type.
     */
    public Map<MovementType, BigDecimal> sumPaidByType(LocalDateTime start, LocalDateTime end, TransactionContext tx) {
        List<Object> params = new ArrayList<>();
        String range = dateRange("movement_date", start, end, params);

        Map<MovementType, BigDecimal> totals = new EnumMap<>(MovementType.class);
        tx.jdbc().query("""
                SELECT type, COALESCE(SUM(value), 0) AS total
                FROM financial_movements
                WHERE payment_status = 'Paid' AND movement_date IS NOT NULL
                """ + range + " GROUP BY type",
                rs -> {
                    totals.put(MovementType.valueOf(rs.getString("type")), rs.getBigDecimal("total"));
                },
                params.toArray());
        return totals;
    }

    /**
     * Sums PENDING outflows (EXPENSE and TAX), dated by their expected date or
     * creation time, in {@code [start, end)}.
     */
    public BigDecimal sumPendingOutflow(LocalDateTime start, LocalDateTime end, TransactionContext tx) {
        List<Object> params = new ArrayList<>();
        String range = dateRange("COALESCE(movement_date, created_at)", start, end, params);

        BigDecimal total = tx.jdbc().queryForObject("""
                SELECT COALESCE(SUM(value), 0)
                FROM financial_movements
                WHERE payment_status = 'Pending' AND type IN ('EXPENSE', 'TAX')
                """ + range, BigDecimal.class, params.toArray());
        return total == null ? BigDecimal.ZERO : total;
    }

    /**
     * Open work across the whole ledger: pending outflows still to pay and
     * paid movements not yet matched to a bank statement.
     */
    public LedgerBacklog countBacklog(TransactionContext tx) {
        return tx.jdbc().queryForObject("""
                SELECT
                    COUNT(*) FILTER (WHERE payment_status = 'Pending' AND type IN ('EXPENSE', 'TAX')) AS pending_payables,
                    COUNT(*) FILTER (WHERE payment_status = 'Paid' AND NOT reconciled) AS unreconciled
                FROM financial_movements
                """, (rs, rowNum) -> new LedgerBacklog(rs.getLong("pending_payables"), rs.getLong("unreconciled")));
    }

    public record LedgerBacklog(long pendingPayables, long unreconciledPaid) {
    }

    public List<FinancialMovement> findPaidForReconciliation(LocalDateTime start, LocalDateTime end,
                                                             Boolean reconciled, String paymentGatewayId,
                                                             TransactionContext tx) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder(SELECT_MOVEMENT)
                .append(" WHERE fm.payment_status = 'Paid'")
                .append(dateRange("fm.movement_date", start, end, params));
        if (reconciled != null) {
            sql.append(" AND fm.reconciled = ?");
            params.add(reconciled);
        }
        if (paymentGatewayId != null) {
            sql.append(" AND fm.payment_gateway_id = ?");
            params.add(paymentGatewayId);
        }
        sql.append(" ORDER BY fm.movement_date DESC, fm.id DESC");
        return tx.jdbc().query(sql.toString(), MOVEMENT_MAPPER, params.toArray());
    }

    private static String dateRange(String column, LocalDateTime start, LocalDateTime end, List<Object> params) {
        StringBuilder range = new StringBuilder();
        if (start != null) {
            range.append(" AND ").append(column).append(" >= ?");
            params.add(start);
        }
        if (end != null) {
            range.append(" AND ").append(column).append(" < ?");
            params.add(end);
        }
        return range.toString();
    }

    private static Object[] insertArgs(NewMovement movement, Long userId) {
        return new Object[]{
                movement.getType().name(),
                movement.getValue(),
                movement.getCategory(),
                movement.getSubcategory(),
                movement.getDescription(),
                movement.getMovementDate(),
                movement.getPaymentStatus().getLabel(),
                movement.getPaymentMethod(),
                movement.getSenderReceiver(),
                movement.getRelatedEntityType(),
                movement.getRelatedEntityId(),
                movement.getRecurrencePeriodKey(),
                movement.getNotes(),
                movement.getPaymentGatewayId(),
                movement.getTransactionId(),
                movement.getBankAccount(),
                userId
        };
    }

    private static FinancialMovement mapMovement(ResultSet rs, int rowNum) throws SQLException {
        return FinancialMovement.builder()
                .id(rs.getLong("id"))
                .type(MovementType.valueOf(rs.getString("type")))
                .value(rs.getBigDecimal("value"))
                .category(rs.getString("category"))
                .subcategory(rs.getString("subcategory"))
                .description(rs.getString("description"))
                .movementDate(rs.getObject("movement_date", LocalDateTime.class))
                .paymentStatus(PaymentStatus.parse(rs.getString("payment_status")))
                .paymentMethod(rs.getString("payment_method"))
                .senderReceiver(rs.getString("sender_receiver"))
                .relatedEntityType(rs.getString("related_entity_type"))
                .relatedEntityId(rs.getObject("related_entity_id", Long.class))
                .recurrencePeriodKey(rs.getString("recurrence_period_key"))
                .notes(rs.getString("notes"))
                .paymentGatewayId(rs.getString("payment_gateway_id"))
                .transactionId(rs.getString("transaction_id"))
                .bankAccount(rs.getString("bank_account"))
                .reconciled(rs.getBoolean("reconciled"))
                .reconciledAt(rs.getObject("reconciled_at", LocalDateTime.class))
                .createdBy(rs.getObject("created_by", Long.class))
                .createdByName(rs.getString("created_by_name"))
                .updatedBy(rs.getObject("updated_by", Long.class))
                .createdAt(rs.getObject("created_at", LocalDateTime.class))
                .updatedAt(rs.getObject("updated_at", LocalDateTime.class))
                .build();
    }
}
