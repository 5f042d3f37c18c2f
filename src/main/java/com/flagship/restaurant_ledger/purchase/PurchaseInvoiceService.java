package com.flagship.restaurant_ledger.purchase;

import com.flagship.restaurant_ledger.audit.AuditAction;
import com.flagship.restaurant_ledger.audit.AuditEntry;
import com.flagship.restaurant_ledger.audit.PurchaseAuditLog;
import com.flagship.restaurant_ledger.common.PageResult;
import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;
import com.flagship.restaurant_ledger.common.tx.TransactionContext;
import com.flagship.restaurant_ledger.common.tx.TransactionRunner;
import com.flagship.restaurant_ledger.event.EventPublisher;
import com.flagship.restaurant_ledger.event.PurchaseCreatedEvent;
import com.flagship.restaurant_ledger.event.PurchaseUpdatedEvent;
import com.flagship.restaurant_ledger.ledger.FinancialMovement;
import com.flagship.restaurant_ledger.ledger.LedgerCategories;
import com.flagship.restaurant_ledger.ledger.LedgerStore;
import com.flagship.restaurant_ledger.ledger.MovementDateParser;
import com.flagship.restaurant_ledger.ledger.MovementRecorder;
import com.flagship.restaurant_ledger.ledger.MovementType;
import com.flagship.restaurant_ledger.ledger.NewMovement;
import com.flagship.restaurant_ledger.ledger.PaymentStatus;
import com.flagship.restaurant_ledger.observability.CorrelationContext;
import com.flagship.restaurant_ledger.observability.LedgerMetrics;
import com.flagship.restaurant_ledger.purchase.dto.CreateInvoiceRequest;
import com.flagship.restaurant_ledger.purchase.dto.InvoiceDeletion;
import com.flagship.restaurant_ledger.purchase.dto.StockShortage;
import com.flagship.restaurant_ledger.purchase.dto.UpdateInvoiceRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Registers, edits and removes supplier invoices.
 *
 * Each operation runs in one transaction that covers the invoice, its items,
 * the ingredient stock it moved and its linked EXPENSE movement, so either all
 * of them change or none does. Audit entries are best-effort; cache
 * invalidation and events happen after commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseInvoiceService {

    private final TransactionRunner transactionRunner;
    private final PurchaseInvoiceRepository invoiceRepository;
    private final IngredientStockRepository stockRepository;
    private final InvoiceItemPricer itemPricer;
    private final InvoicePermissionGate permissionGate;
    private final PurchaseAuditLog auditLog;
    private final MovementRecorder movementRecorder;
    private final LedgerStore ledgerStore;
    private final EventPublisher eventPublisher;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Registers an invoice, adds every line's quantity to stock and books the
     * linked EXPENSE.
     */
    public PurchaseInvoice create(CreateInvoiceRequest request, Long userId) {
        String invoiceNumber = required(request.getInvoiceNumber(), ErrorCode.INVALID_INVOICE_NUMBER);
        String supplierName = required(request.getSupplierName(), ErrorCode.INVALID_SUPPLIER_NAME);
        PaymentStatus status = PaymentStatus.parseOrPending(request.getPaymentStatus());

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime purchaseDate = MovementDateParser.parse(request.getPurchaseDate());
        LocalDateTime paymentDate = MovementDateParser.parse(request.getPaymentDate());
        if (status == PaymentStatus.PAID && paymentDate == null) {
            paymentDate = now;
        }

        List<PurchaseInvoiceItem> items = itemPricer.price(request.getItems());
        BigDecimal totalAmount = InvoiceItemPricer.sumTotals(items);
        if (request.getTotalAmount() != null && request.getTotalAmount().compareTo(totalAmount) != 0) {
            log.warn("Invoice {} declared total {} differs from the sum of its lines {}; using the sum",
                    invoiceNumber, request.getTotalAmount(), totalAmount);
        }

        PurchaseInvoice draft = PurchaseInvoice.builder()
                .invoiceNumber(invoiceNumber)
                .supplierName(supplierName)
                .totalAmount(totalAmount)
                .purchaseDate(purchaseDate != null ? purchaseDate : now)
                .paymentStatus(status)
                .paymentMethod(request.getPaymentMethod())
                .paymentDate(paymentDate)
                .notes(request.getNotes())
                .items(items)
                .build();

        log.info("Registering invoice {} from {}: {} lines, total={}",
                invoiceNumber, supplierName, items.size(), totalAmount);

        return track("purchase.create", () -> transactionRunner.inTransaction(tx -> {
            requireIngredientsExist(items, tx);

            long invoiceId = invoiceRepository.insertInvoice(draft, userId, tx);
            MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, String.valueOf(invoiceId));

            for (PurchaseInvoiceItem item : items) {
                invoiceRepository.insertItem(invoiceId, item, tx);
                addStock(item.getIngredientId(), item.getQuantity(), tx);
            }

            FinancialMovement expense = movementRecorder.record(
                    expenseFor(draft.toBuilder().id(invoiceId).build()), userId, tx);

            PurchaseInvoice saved = load(invoiceId, tx);
            auditLog.record(invoiceId, AuditAction.CREATE, userId, null, saved, null, null, tx);

            tx.afterCommit("publish " + PurchaseCreatedEvent.EVENT_TYPE, () -> eventPublisher.publish(
                    PurchaseCreatedEvent.of(invoiceId, invoiceNumber, supplierName, totalAmount,
                            items.size(), expense.getId())));

            log.info("Registered invoice: id={}, expenseId={}", invoiceId, expense.getId());
            return saved;
        }));
    }

    /**
     * Applies a partial update. New items replace the old ones: the old
     * quantities are taken out of stock and the new ones put in, and the
     * total and linked EXPENSE follow.
     */
    public PurchaseInvoice update(long invoiceId, UpdateInvoiceRequest request, Long userId) {
        if (request == null || request.isEmpty()) {
            throw new LedgerException(ErrorCode.NO_UPDATES);
        }
        PaymentStatus requestedStatus = request.getPaymentStatus() == null
                ? null
                : PaymentStatus.parse(request.getPaymentStatus());
        LocalDateTime requestedPaymentDate = MovementDateParser.parse(request.getPaymentDate());
        List<PurchaseInvoiceItem> newItems = request.getItems() == null || request.getItems().isEmpty()
                ? null
                : itemPricer.price(request.getItems());

        return track("purchase.update", () -> transactionRunner.inTransaction(tx -> {
            MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, String.valueOf(invoiceId));
            PurchaseInvoice before = invoiceRepository.findByIdForUpdate(invoiceId, tx)
                    .orElseThrow(() -> LedgerException.notFound("Purchase invoice", invoiceId));
            permissionGate.check(before, userId, InvoiceAction.EDIT);

            List<String> changedFields = new ArrayList<>();
            BigDecimal totalAmount = before.getTotalAmount();

            if (newItems != null) {
                totalAmount = replaceItems(before, newItems, tx);
                changedFields.add("items");
                if (totalAmount.compareTo(before.getTotalAmount()) != 0) {
                    changedFields.add("total_amount");
                }
            }

            PaymentStatus status = requestedStatus != null ? requestedStatus : before.getPaymentStatus();
            String paymentMethod = request.getPaymentMethod() != null
                    ? request.getPaymentMethod()
                    : before.getPaymentMethod();
            String notes = request.getNotes() != null ? request.getNotes() : before.getNotes();
            LocalDateTime paymentDate = requestedPaymentDate != null
                    ? requestedPaymentDate
                    : before.getPaymentDate();
            if (status == PaymentStatus.PAID && paymentDate == null) {
                paymentDate = LocalDateTime.now(clock);
            }

            addIfChanged(changedFields, "payment_status", before.getPaymentStatus(), status);
            addIfChanged(changedFields, "payment_method", before.getPaymentMethod(), paymentMethod);
            addIfChanged(changedFields, "payment_date", before.getPaymentDate(), paymentDate);
            addIfChanged(changedFields, "notes", before.getNotes(), notes);

            invoiceRepository.updatePayment(invoiceId, status, paymentMethod, paymentDate, notes, tx);
            syncExpense(invoiceId, status, paymentMethod, paymentDate, totalAmount, userId, tx);

            PurchaseInvoice after = load(invoiceId, tx);
            auditLog.record(invoiceId, AuditAction.UPDATE, userId, before, after, changedFields, null, tx);

            movementRecorder.invalidateAfterCommit(tx);
            BigDecimal finalTotal = totalAmount;
            tx.afterCommit("publish " + PurchaseUpdatedEvent.EVENT_TYPE, () -> eventPublisher.publish(
                    PurchaseUpdatedEvent.of(invoiceId, changedFields, finalTotal, status.getLabel())));

            log.info("Updated invoice {}: changed={}", invoiceId, changedFields);
            return after;
        }));
    }

    /**
     * Deletes an invoice, taking its quantities back out of stock and removing
     * its EXPENSE. Rejected with INSUFFICIENT_STOCK, and nothing changed, if
     * any ingredient no longer holds what the invoice added.
     */
    public InvoiceDeletion delete(long invoiceId, Long userId) {
        return track("purchase.delete", () -> transactionRunner.inTransaction(tx -> {
            MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, String.valueOf(invoiceId));
            PurchaseInvoice invoice = invoiceRepository.findByIdForUpdate(invoiceId, tx)
                    .orElseThrow(() -> LedgerException.notFound("Purchase invoice", invoiceId));
            permissionGate.check(invoice, userId, InvoiceAction.DELETE);

            Map<Long, BigDecimal> reversal = quantitiesByIngredient(invoice.getItems());
            List<IngredientStock> locked = stockRepository.lockForUpdate(reversal.keySet(), tx);

            List<StockShortage> shortages = findShortages(locked, reversal);
            if (!shortages.isEmpty()) {
                log.warn("Cannot delete invoice {}: {} ingredient(s) short of stock", invoiceId, shortages.size());
                throw new LedgerException(ErrorCode.INSUFFICIENT_STOCK,
                        "Deleting invoice " + invoiceId + " would make stock negative", shortages);
            }

            for (Map.Entry<Long, BigDecimal> entry : reversal.entrySet()) {
                subtractStock(entry.getKey(), entry.getValue(), tx);
            }

            ledgerStore.deleteRelated(MovementType.EXPENSE, LedgerCategories.RELATED_PURCHASE_INVOICE, invoiceId, tx);

            boolean audited = auditLog.record(invoiceId, AuditAction.DELETE, userId, invoice, null, null,
                    "Invoice deleted and stock reversed", tx);

            invoiceRepository.deleteItems(invoiceId, tx);
            if (invoiceRepository.deleteInvoice(invoiceId, tx) == 0) {
                throw new IllegalStateException("Locked invoice disappeared during delete: " + invoiceId);
            }

            movementRecorder.invalidateAfterCommit(tx);
            log.info("Deleted invoice {}: reversed {} ingredient(s), expenseId={}",
                    invoiceId, reversal.size(), invoice.getExpenseId());
            return new InvoiceDeletion(invoiceId, invoice.getExpenseId(), new ArrayList<>(reversal.keySet()), audited);
        }));
    }

    public PurchaseInvoice getById(long invoiceId) {
        return transactionRunner.readOnly(tx -> invoiceRepository.findById(invoiceId, tx))
                .orElseThrow(() -> LedgerException.notFound("Purchase invoice", invoiceId));
    }

    public PageResult<PurchaseInvoice> list(InvoiceFilter filter, Integer page, Integer pageSize) {
        int safePage = PageResult.clampPage(page);
        int safePageSize = PageResult.clampPageSize(pageSize);
        return transactionRunner.readOnly(tx -> invoiceRepository.find(filter, safePage, safePageSize, tx));
    }

    public List<AuditEntry> getAuditTrail(long invoiceId) {
        return transactionRunner.readOnly(tx -> auditLog.findByInvoice(invoiceId, tx));
    }

    private BigDecimal replaceItems(PurchaseInvoice before, List<PurchaseInvoiceItem> newItems, TransactionContext tx) {
        Set<Long> touched = new TreeSet<>();
        before.getItems().forEach(item -> touched.add(item.getIngredientId()));
        newItems.forEach(item -> touched.add(item.getIngredientId()));
        stockRepository.lockForUpdate(touched, tx);

        requireIngredientsExist(newItems, tx);

        for (PurchaseInvoiceItem old : before.getItems()) {
            subtractStock(old.getIngredientId(), old.getQuantity(), tx);
        }
        invoiceRepository.deleteItems(before.getId(), tx);

        for (PurchaseInvoiceItem item : newItems) {
            invoiceRepository.insertItem(before.getId(), item, tx);
            addStock(item.getIngredientId(), item.getQuantity(), tx);
        }

        BigDecimal totalAmount = InvoiceItemPricer.sumTotals(newItems);
        invoiceRepository.updateTotal(before.getId(), totalAmount, tx);
        return totalAmount;
    }

    private void syncExpense(long invoiceId, PaymentStatus status, String paymentMethod,
                             LocalDateTime paymentDate, BigDecimal totalAmount, Long userId, TransactionContext tx) {
        FinancialMovement expense = ledgerStore.findRelated(MovementType.EXPENSE,
                        LedgerCategories.RELATED_PURCHASE_INVOICE, invoiceId, tx)
                .orElseThrow(() -> new LedgerException(ErrorCode.SYNC_ERROR,
                        "Invoice " + invoiceId + " has no linked expense"));

        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("value", totalAmount);
        columns.put("payment_status", status.getLabel());
        columns.put("movement_date", status == PaymentStatus.PAID ? paymentDate : null);
        columns.put("payment_method", paymentMethod);

        if (ledgerStore.update(expense.getId(), columns, userId, tx) != 1) {
            throw new LedgerException(ErrorCode.SYNC_ERROR,
                    "Expense " + expense.getId() + " of invoice " + invoiceId + " could not be updated");
        }
    }

    private NewMovement expenseFor(PurchaseInvoice invoice) {
        return NewMovement.builder()
                .type(MovementType.EXPENSE)
                .value(invoice.getTotalAmount())
                .category(LedgerCategories.STOCK_PURCHASES)
                .subcategory(LedgerCategories.INGREDIENTS)
                .description("Purchase - Invoice " + invoice.getInvoiceNumber() + " - " + invoice.getSupplierName())
                .movementDate(invoice.getPaymentStatus() == PaymentStatus.PAID ? invoice.getPaymentDate() : null)
                .paymentStatus(invoice.getPaymentStatus())
                .paymentMethod(invoice.getPaymentMethod())
                .senderReceiver(invoice.getSupplierName())
                .relatedEntityType(LedgerCategories.RELATED_PURCHASE_INVOICE)
                .relatedEntityId(invoice.getId())
                .notes(invoice.getNotes())
                .build();
    }

    private void requireIngredientsExist(List<PurchaseInvoiceItem> items, TransactionContext tx) {
        Set<Long> requested = items.stream()
                .map(PurchaseInvoiceItem::getIngredientId)
                .collect(Collectors.toCollection(TreeSet::new));
        Set<Long> existing = stockRepository.findExistingIds(requested, tx);
        List<Long> missing = requested.stream()
                .filter(id -> !existing.contains(id))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new LedgerException(ErrorCode.INGREDIENT_NOT_FOUND,
                    "Ingredients not found: " + missing, missing);
        }
    }

    private void addStock(long ingredientId, BigDecimal quantity, TransactionContext tx) {
        if (stockRepository.addStock(ingredientId, quantity, tx) == 0) {
            throw new LedgerException(ErrorCode.STOCK_UPDATE_ERROR,
                    "Stock of ingredient " + ingredientId + " could not be updated");
        }
    }

    private void subtractStock(long ingredientId, BigDecimal quantity, TransactionContext tx) {
        if (stockRepository.subtractStock(ingredientId, quantity, tx) == 0) {
            throw new LedgerException(ErrorCode.STOCK_REVERSAL_ERROR,
                    "Stock of ingredient " + ingredientId + " could not be reversed");
        }
    }

    static Map<Long, BigDecimal> quantitiesByIngredient(List<PurchaseInvoiceItem> items) {
        Map<Long, BigDecimal> totals = new TreeMap<>();
        for (PurchaseInvoiceItem item : items) {
            totals.merge(item.getIngredientId(), item.getQuantity(), BigDecimal::add);
        }
        return totals;
    }

    static List<StockShortage> findShortages(List<IngredientStock> stock, Map<Long, BigDecimal> reversal) {
        List<StockShortage> shortages = new ArrayList<>();
        for (IngredientStock ingredient : stock) {
            BigDecimal required = reversal.get(ingredient.getId());
            BigDecimal remaining = ingredient.getCurrentStock().subtract(required);
            if (remaining.signum() < 0) {
                shortages.add(new StockShortage(ingredient.getId(), ingredient.getName(),
                        ingredient.getCurrentStock(), required, remaining.negate()));
            }
        }
        return shortages;
    }

    private <T> T track(String operation, Supplier<T> work) {
        long startTime = System.currentTimeMillis();
        try {
            T result = work.get();
            metrics.recordOperation(operation, "success");
            return result;
        } catch (LedgerException e) {
            metrics.recordOperation(operation, e.getErrorCode().name());
            throw e;
        } catch (RuntimeException e) {
            log.error("Invoice operation {} failed", operation, e);
            metrics.recordOperation(operation, "error");
            throw e;
        } finally {
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    private PurchaseInvoice load(long invoiceId, TransactionContext tx) {
        return invoiceRepository.findById(invoiceId, tx)
                .orElseThrow(() -> new IllegalStateException("Invoice vanished inside its transaction: " + invoiceId));
    }

    private static String required(String value, ErrorCode errorCode) {
        if (value == null || value.isBlank()) {
            throw new LedgerException(errorCode);
        }
        return value.trim();
    }

    private static void addIfChanged(List<String> changed, String field, Object before, Object after) {
        if (!Objects.equals(before, after)) {
            changed.add(field);
        }
    }
}
