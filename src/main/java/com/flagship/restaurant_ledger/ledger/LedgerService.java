package com.flagship.restaurant_ledger.ledger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flagship.restaurant_ledger.cache.LedgerCache;
import com.flagship.restaurant_ledger.common.PageResult;
import com.flagship.restaurant_ledger.common.Strings;
import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;
import com.flagship.restaurant_ledger.common.tx.TransactionContext;
import com.flagship.restaurant_ledger.common.tx.TransactionRunner;
import com.flagship.restaurant_ledger.event.EventPublisher;
import com.flagship.restaurant_ledger.event.MovementPaymentStatusUpdatedEvent;
import com.flagship.restaurant_ledger.ledger.dto.CreateMovementRequest;
import com.flagship.restaurant_ledger.ledger.dto.MovementDeletion;
import com.flagship.restaurant_ledger.ledger.dto.UpdateMovementRequest;
import com.flagship.restaurant_ledger.observability.CorrelationContext;
import com.flagship.restaurant_ledger.observability.LedgerMetrics;
import com.flagship.restaurant_ledger.purchase.PurchaseInvoiceRepository;
import com.flagship.restaurant_ledger.purchase.PurchaseInvoiceService;
import com.flagship.restaurant_ledger.purchase.dto.InvoiceDeletion;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The financial ledger: records, lists, edits and deletes movements and
 * produces the cash-flow and reconciliation reports.
 *
 * Movements linked to a purchase invoice stay consistent with it: a payment
 * status change is mirrored onto the invoice, and deleting the expense deletes
 * the whole invoice with its stock effects.
 */
@Service
@Slf4j
public class LedgerService {

    private static final TypeReference<PageResult<FinancialMovement>> MOVEMENT_PAGE =
            new TypeReference<>() {
            };
    private static final TypeReference<CashFlowSummary> CASH_FLOW = new TypeReference<>() {
    };

    private final TransactionRunner transactionRunner;
    private final LedgerStore ledgerStore;
    private final MovementRecorder movementRecorder;
    private final PurchaseInvoiceService purchaseInvoiceService;
    private final PurchaseInvoiceRepository invoiceRepository;
    private final LedgerCache ledgerCache;
    private final EventPublisher eventPublisher;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final Duration cacheTtl;

    public LedgerService(TransactionRunner transactionRunner,
                         LedgerStore ledgerStore,
                         MovementRecorder movementRecorder,
                         PurchaseInvoiceService purchaseInvoiceService,
                         PurchaseInvoiceRepository invoiceRepository,
                         LedgerCache ledgerCache,
                         EventPublisher eventPublisher,
                         LedgerMetrics metrics,
                         Clock clock,
                         @Value("${ledger.cache.ttl-seconds:60}") long cacheTtlSeconds) {
        this.transactionRunner = transactionRunner;
        this.ledgerStore = ledgerStore;
        this.movementRecorder = movementRecorder;
        this.purchaseInvoiceService = purchaseInvoiceService;
        this.invoiceRepository = invoiceRepository;
        this.ledgerCache = ledgerCache;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.clock = clock;
        this.cacheTtl = Duration.ofSeconds(cacheTtlSeconds);
    }

    public FinancialMovement create(CreateMovementRequest request, Long userId) {
        NewMovement movement = request.toNewMovement();
        long startTime = System.currentTimeMillis();
        try {
            FinancialMovement saved = transactionRunner.inTransaction(tx -> movementRecorder.record(movement, userId, tx));
            metrics.recordOperation("movement.create", "success");
            return saved;
        } catch (LedgerException e) {
            metrics.recordOperation("movement.create", e.getErrorCode().name());
            throw e;
        } finally {
            metrics.recordLatency("movement.create", System.currentTimeMillis() - startTime);
        }
    }

    public FinancialMovement getById(long id) {
        return transactionRunner.readOnly(tx -> ledgerStore.findById(id, tx))
                .orElseThrow(() -> LedgerException.notFound("Movement", id));
    }

    /**
     * Lists movements newest first. Pages are cached briefly; any committed
     * movement change drops the cache.
     */
    public PageResult<FinancialMovement> list(MovementFilter filter, Integer page, Integer pageSize) {
        MovementFilter effective = filter == null ? MovementFilter.none() : filter;
        int safePage = PageResult.clampPage(page);
        int safePageSize = PageResult.clampPageSize(pageSize);
        String cacheKey = LedgerCache.MOVEMENTS_PREFIX
                + sha256(effective.normalized() + "|page=" + safePage + "|size=" + safePageSize);

        Optional<PageResult<FinancialMovement>> cached = ledgerCache.get(cacheKey, MOVEMENT_PAGE);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached.get();
        }
        metrics.recordCacheMiss();

        PageResult<FinancialMovement> result = transactionRunner.readOnly(
                tx -> ledgerStore.find(effective, safePage, safePageSize, tx));
        ledgerCache.put(cacheKey, result, cacheTtl);
        return result;
    }

    /**
     * Applies a partial update. A status change on an invoice expense is
     * mirrored onto the invoice.
     */
    public FinancialMovement update(long id, UpdateMovementRequest request, Long userId) {
        Map<String, Object> columns = toColumns(request);
        if (columns.isEmpty()) {
            throw new LedgerException(ErrorCode.NO_UPDATES);
        }

        return transactionRunner.inTransaction(tx -> {
            try (MDC.MDCCloseable ignored = CorrelationContext.tag(CorrelationContext.MOVEMENT_ID_MDC_KEY, id)) {
                FinancialMovement existing = ledgerStore.findByIdForUpdate(id, tx)
                        .orElseThrow(() -> LedgerException.notFound("Movement", id));

                PaymentStatus status = columns.containsKey("payment_status")
                        ? PaymentStatus.parse((String) columns.get("payment_status"))
                        : existing.getPaymentStatus();
                LocalDateTime movementDate = columns.containsKey("movement_date")
                        ? (LocalDateTime) columns.get("movement_date")
                        : existing.getMovementDate();
                if (status == PaymentStatus.PAID && movementDate == null) {
                    movementDate = LocalDateTime.now(clock);
                    columns.put("movement_date", movementDate);
                }

                ledgerStore.update(id, columns, userId, tx);

                if (status != existing.getPaymentStatus()
                        && existing.isLinkedTo(LedgerCategories.RELATED_PURCHASE_INVOICE)) {
                    syncInvoice(existing.getRelatedEntityId(), status, movementDate, tx);
                }

                movementRecorder.invalidateAfterCommit(tx);
                log.info("Updated movement {}: fields={}", id, columns.keySet());
                return load(id, tx);
            }
        });
    }

    /**
     * Marks a movement Paid or Pending. Paid uses the given date or now;
     * Pending clears the date. A linked invoice follows the new status.
     */
    public FinancialMovement updatePaymentStatus(long id, String paymentStatus, String movementDate, Long userId) {
        PaymentStatus status = PaymentStatus.parse(paymentStatus);
        LocalDateTime requestedDate = MovementDateParser.parse(movementDate);

        return transactionRunner.inTransaction(tx -> {
            FinancialMovement existing = ledgerStore.findByIdForUpdate(id, tx)
                    .orElseThrow(() -> LedgerException.notFound("Movement", id));

            LocalDateTime effectiveDate = status == PaymentStatus.PAID
                    ? (requestedDate != null ? requestedDate : LocalDateTime.now(clock))
                    : null;
            ledgerStore.updatePaymentStatus(id, status, effectiveDate, userId, tx);

            Long syncedInvoiceId = null;
            if (existing.isLinkedTo(LedgerCategories.RELATED_PURCHASE_INVOICE)) {
                syncedInvoiceId = existing.getRelatedEntityId();
                syncInvoice(syncedInvoiceId, status, effectiveDate, tx);
            }

            movementRecorder.invalidateAfterCommit(tx);
            Long invoiceId = syncedInvoiceId;
            tx.afterCommit("publish " + MovementPaymentStatusUpdatedEvent.EVENT_TYPE, () -> eventPublisher.publish(
                    MovementPaymentStatusUpdatedEvent.of(id, existing.getPaymentStatus().getLabel(),
                            status.getLabel(), effectiveDate, invoiceId)));

            log.info("Movement {} payment status {} -> {}", id,
                    existing.getPaymentStatus().getLabel(), status.getLabel());
            return load(id, tx);
        });
    }

    public FinancialMovement reconcile(long id, boolean reconciled) {
        return transactionRunner.inTransaction(tx -> {
            LocalDateTime reconciledAt = reconciled ? LocalDateTime.now(clock) : null;
            if (ledgerStore.updateReconciliation(id, reconciled, reconciledAt, tx) == 0) {
                throw LedgerException.notFound("Movement", id);
            }
            movementRecorder.invalidateAfterCommit(tx);
            return load(id, tx);
        });
    }

    public FinancialMovement updateGatewayInfo(long id, String paymentGatewayId, String transactionId,
                                               String bankAccount, Long userId) {
        Map<String, Object> columns = new LinkedHashMap<>();
        putIfPresent(columns, "payment_gateway_id", paymentGatewayId);
        putIfPresent(columns, "transaction_id", transactionId);
        putIfPresent(columns, "bank_account", bankAccount);
        if (columns.isEmpty()) {
            throw new LedgerException(ErrorCode.NO_UPDATES);
        }

        return transactionRunner.inTransaction(tx -> {
            if (ledgerStore.update(id, columns, userId, tx) == 0) {
                throw LedgerException.notFound("Movement", id);
            }
            movementRecorder.invalidateAfterCommit(tx);
            return load(id, tx);
        });
    }

    /**
     * Deletes a movement. The expense of a purchase invoice is never deleted
     * alone: the whole invoice goes, with its stock reversed.
     */
    public MovementDeletion delete(long id, Long userId) {
        FinancialMovement movement = getById(id);

        if (movement.getType() == MovementType.EXPENSE
                && movement.isLinkedTo(LedgerCategories.RELATED_PURCHASE_INVOICE)) {
            log.info("Movement {} is the expense of invoice {}; deleting the invoice",
                    id, movement.getRelatedEntityId());
            InvoiceDeletion deletion = purchaseInvoiceService.delete(movement.getRelatedEntityId(), userId);
            return new MovementDeletion(id, deletion.getInvoiceId());
        }

        return transactionRunner.inTransaction(tx -> {
            if (ledgerStore.delete(id, tx) == 0) {
                throw LedgerException.notFound("Movement", id);
            }
            movementRecorder.invalidateAfterCommit(tx);
            log.info("Deleted movement {}", id);
            return new MovementDeletion(id, null);
        });
    }

    /**
     * Paid totals per type over a period. Pending outflows are added only
     * when asked for.
     */
    public CashFlowSummary cashFlowSummary(String period, boolean includePending) {
        CashFlowPeriod cashFlowPeriod = CashFlowPeriod.parse(period);
        LocalDate today = LocalDate.now(clock);
        String cacheKey = LedgerCache.CASH_FLOW_PREFIX + cashFlowPeriod.getValue()
                + ":" + includePending + ":" + today;

        Optional<CashFlowSummary> cached = ledgerCache.get(cacheKey, CASH_FLOW);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached.get();
        }
        metrics.recordCacheMiss();

        LocalDateTime start = cashFlowPeriod.startFrom(today);
        LocalDateTime end = cashFlowPeriod.endFrom(today);
        CashFlowSummary summary = transactionRunner.readOnly(tx -> CashFlowSummary.of(
                cashFlowPeriod,
                ledgerStore.sumPaidByType(start, end, tx),
                includePending ? ledgerStore.sumPendingOutflow(start, end, tx) : null));

        ledgerCache.put(cacheKey, summary, cacheTtl);
        return summary;
    }

    /**
     * Paid movements in {@code [startDate, endDate]}, split by reconciliation state.
     */
    public ReconciliationReport reconciliationReport(String startDate, String endDate,
                                                     Boolean reconciled, String paymentGatewayId) {
        LocalDate start = MovementDateParser.parseDate(startDate);
        LocalDate end = MovementDateParser.parseDate(endDate);
        String gateway = Strings.blankToNull(paymentGatewayId);

        List<FinancialMovement> movements = transactionRunner.readOnly(tx -> ledgerStore.findPaidForReconciliation(
                start == null ? null : start.atStartOfDay(),
                end == null ? null : end.plusDays(1).atStartOfDay(),
                reconciled, gateway, tx));

        long reconciledCount = 0;
        BigDecimal reconciledAmount = BigDecimal.ZERO;
        BigDecimal totalAmount = BigDecimal.ZERO;
        for (FinancialMovement movement : movements) {
            totalAmount = totalAmount.add(movement.getValue());
            if (movement.isReconciled()) {
                reconciledCount++;
                reconciledAmount = reconciledAmount.add(movement.getValue());
            }
        }

        return ReconciliationReport.builder()
                .totalCount(movements.size())
                .reconciledCount(reconciledCount)
                .unreconciledCount(movements.size() - reconciledCount)
                .totalAmount(totalAmount)
                .reconciledAmount(reconciledAmount)
                .unreconciledAmount(totalAmount.subtract(reconciledAmount))
                .movements(movements)
                .build();
    }

    private void syncInvoice(long invoiceId, PaymentStatus status, LocalDateTime paymentDate, TransactionContext tx) {
        if (invoiceRepository.syncPaymentStatus(invoiceId, status, paymentDate, tx) == 0) {
            throw new LedgerException(ErrorCode.SYNC_ERROR,
                    "Linked purchase invoice " + invoiceId + " could not be updated");
        }
        log.info("Synchronized invoice {} to payment status {}", invoiceId, status.getLabel());
    }

    private static Map<String, Object> toColumns(UpdateMovementRequest request) {
        Map<String, Object> columns = new LinkedHashMap<>();
        if (request == null) {
            return columns;
        }
        if (request.getType() != null) {
            columns.put("type", MovementType.parse(request.getType()).name());
        }
        if (request.getValue() != null) {
            columns.put("value", MovementRecorder.requirePositiveValue(request.getValue()));
        }
        if (request.getDescription() != null) {
            if (request.getDescription().isBlank()) {
                throw new LedgerException(ErrorCode.INVALID_DESCRIPTION);
            }
            columns.put("description", request.getDescription().trim());
        }
        if (request.getMovementDate() != null) {
            columns.put("movement_date", MovementDateParser.parse(request.getMovementDate()));
        }
        if (request.getPaymentStatus() != null) {
            columns.put("payment_status", PaymentStatus.parse(request.getPaymentStatus()).getLabel());
        }
        putIfPresent(columns, "category", request.getCategory());
        putIfPresent(columns, "subcategory", request.getSubcategory());
        putIfPresent(columns, "payment_method", request.getPaymentMethod());
        putIfPresent(columns, "sender_receiver", request.getSenderReceiver());
        putIfPresent(columns, "notes", request.getNotes());
        return columns;
    }

    private static void putIfPresent(Map<String, Object> columns, String column, String value) {
        if (value != null) {
            columns.put(column, value);
        }
    }

    private FinancialMovement load(long id, TransactionContext tx) {
        return ledgerStore.findById(id, tx).orElseThrow(() -> LedgerException.notFound("Movement", id));
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
