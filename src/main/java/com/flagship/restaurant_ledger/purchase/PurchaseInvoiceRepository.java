package com.flagship.restaurant_ledger.purchase;

import com.flagship.restaurant_ledger.common.PageResult;
import com.flagship.restaurant_ledger.common.tx.TransactionContext;
import com.flagship.restaurant_ledger.ledger.PaymentStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * SQL access to {@code purchase_invoices} and {@code purchase_invoice_items}.
 */
@Repository
public class PurchaseInvoiceRepository {

    private static final String SELECT_INVOICE = """
        SELECT pi.*, u.full_name AS created_by_name, fm.id AS expense_id
        FROM purchase_invoices pi
        LEFT JOIN users u ON u.id = pi.created_by
        LEFT JOIN financial_movements fm
               ON fm.related_entity_type = 'purchase_invoice'
              AND fm.type = 'EXPENSE'
              AND fm.related_entity_id = pi.id
        """;

    private static final RowMapper<PurchaseInvoice> INVOICE_MAPPER = (rs, rowNum) -> PurchaseInvoice.builder()
            .id(rs.getLong("id"))
            .invoiceNumber(rs.getString("invoice_number"))
            .supplierName(rs.getString("supplier_name"))
            .totalAmount(rs.getBigDecimal("total_amount"))
            .purchaseDate(rs.getObject("purchase_date", LocalDateTime.class))
            .paymentStatus(PaymentStatus.parse(rs.getString("payment_status")))
            .paymentMethod(rs.getString("payment_method"))
            .paymentDate(rs.getObject("payment_date", LocalDateTime.class))
            .notes(rs.getString("notes"))
            .createdBy(rs.getObject("created_by", Long.class))
            .createdByName(rs.getString("created_by_name"))
            .createdAt(rs.getObject("created_at", LocalDateTime.class))
            .updatedAt(rs.getObject("updated_at", LocalDateTime.class))
            .expenseId(rs.getObject("expense_id", Long.class))
            .items(List.of())
            .build();

    private static final RowMapper<PurchaseInvoiceItem> ITEM_MAPPER = (rs, rowNum) -> PurchaseInvoiceItem.builder()
            .id(rs.getLong("id"))
            .ingredientId(rs.getLong("ingredient_id"))
            .ingredientName(rs.getString("ingredient_name"))
            .quantity(rs.getBigDecimal("quantity"))
            .unitPrice(rs.getBigDecimal("unit_price"))
            .totalPrice(rs.getBigDecimal("total_price"))
            .build();

    public long insertInvoice(PurchaseInvoice invoice, Long userId, TransactionContext tx) {
        return tx.jdbc().queryForObject("""
                INSERT INTO purchase_invoices (
                    invoice_number, supplier_name, total_amount, purchase_date, payment_status,
                    payment_method, payment_date, notes, created_by, created_at, updated_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
                RETURNING id
                """, Long.class,
                invoice.getInvoiceNumber(),
                invoice.getSupplierName(),
                invoice.getTotalAmount(),
                invoice.getPurchaseDate(),
                invoice.getPaymentStatus().getLabel(),
                invoice.getPaymentMethod(),
                invoice.getPaymentDate(),
                invoice.getNotes(),
                userId);
    }

    public long insertItem(long invoiceId, PurchaseInvoiceItem item, TransactionContext tx) {
        return tx.jdbc().queryForObject("""
                INSERT INTO purchase_invoice_items (purchase_invoice_id, ingredient_id, quantity, unit_price, total_price)
                VALUES (?, ?, ?, ?, ?)
                RETURNING id
                """, Long.class,
                invoiceId, item.getIngredientId(), item.getQuantity(), item.getUnitPrice(), item.getTotalPrice());
    }

    /**
     * Loads an invoice with its items.
     */
    public Optional<PurchaseInvoice> findById(long id, TransactionContext tx) {
        return tx.jdbc().query(SELECT_INVOICE + " WHERE pi.id = ?", INVOICE_MAPPER, id)
                .stream()
                .findFirst()
                .map(invoice -> invoice.toBuilder().items(findItems(id, tx)).build());
    }

    /**
     * Loads an invoice with its items and locks the invoice row.
     */
    public Optional<PurchaseInvoice> findByIdForUpdate(long id, TransactionContext tx) {
        return tx.jdbc().query(SELECT_INVOICE + " WHERE pi.id = ? FOR UPDATE OF pi", INVOICE_MAPPER, id)
                .stream()
                .findFirst()
                .map(invoice -> invoice.toBuilder().items(findItems(id, tx)).build());
    }

    public List<PurchaseInvoiceItem> findItems(long invoiceId, TransactionContext tx) {
        return tx.jdbc().query("""
                SELECT pii.*, i.name AS ingredient_name
                FROM purchase_invoice_items pii
                JOIN ingredients i ON i.id = pii.ingredient_id
                WHERE pii.purchase_invoice_id = ?
                ORDER BY pii.id
                """, ITEM_MAPPER, invoiceId);
    }

    public PageResult<PurchaseInvoice> find(InvoiceFilter filter, int page, int pageSize, TransactionContext tx) {
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        if (filter.getSupplierName() != null && !filter.getSupplierName().isBlank()) {
            conditions.add("LOWER(pi.supplier_name) LIKE ?");
            params.add("%" + filter.getSupplierName().trim().toLowerCase(Locale.ROOT) + "%");
        }
        if (filter.getStartDate() != null) {
            conditions.add("pi.purchase_date >= ?");
            params.add(filter.getStartDate().atStartOfDay());
        }
        if (filter.getEndDate() != null) {
            conditions.add("pi.purchase_date < ?");
            params.add(filter.getEndDate().plusDays(1).atStartOfDay());
        }
        if (filter.getPaymentStatus() != null) {
            conditions.add("pi.payment_status = ?");
            params.add(filter.getPaymentStatus().getLabel());
        }

        String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);

        Long total = tx.jdbc().queryForObject(
                "SELECT COUNT(*) FROM purchase_invoices pi" + where, Long.class, params.toArray());

        List<Object> pageParams = new ArrayList<>(params);
        pageParams.add(pageSize);
        pageParams.add((long) (page - 1) * pageSize);

        List<PurchaseInvoice> invoices = tx.jdbc().query(SELECT_INVOICE + where
                        + " ORDER BY pi.purchase_date DESC, pi.id DESC LIMIT ? OFFSET ?",
                INVOICE_MAPPER, pageParams.toArray());

        List<PurchaseInvoice> withItems = new ArrayList<>(invoices.size());
        for (PurchaseInvoice invoice : invoices) {
            withItems.add(invoice.toBuilder().items(findItems(invoice.getId(), tx)).build());
        }
        return PageResult.of(withItems, page, pageSize, total == null ? 0 : total);
    }

    public int updateTotal(long invoiceId, BigDecimal totalAmount, TransactionContext tx) {
        return tx.jdbc().update(
                "UPDATE purchase_invoices SET total_amount = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                totalAmount, invoiceId);
    }

    public int updatePayment(long invoiceId, PaymentStatus status, String paymentMethod,
                             LocalDateTime paymentDate, String notes, TransactionContext tx) {
        return tx.jdbc().update("""
                UPDATE purchase_invoices
                SET payment_status = ?, payment_method = ?, payment_date = ?, notes = ?,
                    updated_at = CURRENT_TIMESTAMP
                WHERE id = ?
                """, status.getLabel(), paymentMethod, paymentDate, notes, invoiceId);
    }

    /**
     * Mirrors a payment status change made on the linked expense. The payment
     * date is only filled in when the invoice has none.
     */
    public int syncPaymentStatus(long invoiceId, PaymentStatus status, LocalDateTime paymentDate,
                                 TransactionContext tx) {
        return tx.jdbc().update("""
                UPDATE purchase_invoices
                SET payment_status = ?, payment_date = COALESCE(payment_date, ?), updated_at = CURRENT_TIMESTAMP
                WHERE id = ?
                """, status.getLabel(), paymentDate, invoiceId);
    }

    public int deleteItems(long invoiceId, TransactionContext tx) {
        return tx.jdbc().update("DELETE FROM purchase_invoice_items WHERE purchase_invoice_id = ?", invoiceId);
    }

    public int deleteInvoice(long invoiceId, TransactionContext tx) {
        return tx.jdbc().update("DELETE FROM purchase_invoices WHERE id = ?", invoiceId);
    }
}
