package com.flagship.restaurant_ledger.settlement;

import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;
import com.flagship.restaurant_ledger.common.tx.TransactionContext;
import com.flagship.restaurant_ledger.common.tx.TransactionRunner;
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
import com.flagship.restaurant_ledger.settlement.dto.SettlementResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Books a finished order into the ledger: its revenue, the cost of the
 * ingredients it consumed and the fee its payment method carries.
 *
 * All movements of one order are written in one transaction. Settling an
 * order twice books nothing the second time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderSettlementService {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final TransactionRunner transactionRunner;
    private final OrderLineRepository orderLineRepository;
    private final OrderCostCalculator costCalculator;
    private final PaymentFeeSettings feeSettings;
    private final MovementRecorder movementRecorder;
    private final LedgerStore ledgerStore;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public SettlementResult registerOrderRevenueAndCmv(long orderId, BigDecimal orderTotal, String paymentMethod,
                                                       String paymentDate, Long userId) {
        if (orderTotal == null || orderTotal.signum() <= 0) {
            throw new LedgerException(ErrorCode.INVALID_VALUE, "Order total must be greater than zero");
        }
        LocalDateTime requestedDate = MovementDateParser.parse(paymentDate);

        try (MDC.MDCCloseable ignored = CorrelationContext.tag(CorrelationContext.ORDER_ID_MDC_KEY, orderId)) {
            return metrics.timeSettlement(() -> transactionRunner.inTransaction(tx -> {
                if (!orderLineRepository.lockOrder(orderId, tx)) {
                    throw LedgerException.notFound("Order", orderId);
                }

                Optional<SettlementResult> existing = findExisting(orderId, tx);
                if (existing.isPresent()) {
                    log.info("Order {} is already settled; returning the existing movements", orderId);
                    metrics.recordOperation("order.settle", "already_settled");
                    return existing.get();
                }

                List<OrderLine> lines = orderLineRepository.findLines(orderId, tx);
                if (lines.isEmpty()) {
                    throw new LedgerException(ErrorCode.NOT_FOUND, "Order " + orderId + " has no items");
                }

                LocalDateTime settledAt = requestedDate != null ? requestedDate : LocalDateTime.now(clock);
                SettlementResult result = book(orderId, orderTotal, paymentMethod, settledAt, lines, userId, tx);
                metrics.recordOperation("order.settle", "success");
                return result;
            }));
        } catch (LedgerException e) {
            metrics.recordOperation("order.settle", e.getErrorCode().name());
            throw e;
        }
    }

    private SettlementResult book(long orderId, BigDecimal orderTotal, String paymentMethod, LocalDateTime settledAt,
                                  List<OrderLine> lines, Long userId, TransactionContext tx) {
        FinancialMovement revenue = movementRecorder.record(NewMovement.builder()
                .type(MovementType.REVENUE)
                .value(orderTotal)
                .category(LedgerCategories.SALES)
                .subcategory(PaymentMethodLabels.subcategoryFor(paymentMethod))
                .description("Sale - Order #" + orderId)
                .movementDate(settledAt)
                .paymentStatus(PaymentStatus.PAID)
                .paymentMethod(paymentMethod)
                .relatedEntityType(LedgerCategories.RELATED_ORDER)
                .relatedEntityId(orderId)
                .build(), userId, tx);

        BigDecimal totalCmv = costCalculator.totalCost(lines);
        Long cmvId = null;
        if (totalCmv.signum() > 0) {
            cmvId = movementRecorder.record(NewMovement.builder()
                    .type(MovementType.CMV)
                    .value(totalCmv)
                    .category(LedgerCategories.VARIABLE_COSTS)
                    .subcategory(LedgerCategories.INGREDIENTS_CONSUMED)
                    .description("CMV - Order #" + orderId)
                    .movementDate(settledAt)
                    .paymentStatus(PaymentStatus.PAID)
                    .relatedEntityType(LedgerCategories.RELATED_ORDER)
                    .relatedEntityId(orderId)
                    .build(), userId, tx).getId();
        }

        BigDecimal feePercentage = feeSettings.feePercentage(paymentMethod, tx);
        BigDecimal feeAmount = orderTotal.multiply(feePercentage).divide(HUNDRED, 2, RoundingMode.HALF_UP);
        Long feeId = null;
        if (feeAmount.signum() > 0) {
            feeId = movementRecorder.record(NewMovement.builder()
                    .type(MovementType.EXPENSE)
                    .value(feeAmount)
                    .category(LedgerCategories.VARIABLE_COSTS)
                    .subcategory(LedgerCategories.PAYMENT_FEES)
                    .description("Fee " + paymentMethod + " - Order #" + orderId)
                    .movementDate(settledAt)
                    .paymentStatus(PaymentStatus.PAID)
                    .paymentMethod(paymentMethod)
                    .relatedEntityType(LedgerCategories.RELATED_ORDER)
                    .relatedEntityId(orderId)
                    .build(), userId, tx).getId();
        }

        log.info("Settled order {}: revenue={}, cmv={} ({}), fee={} ({}%)",
                orderId, orderTotal, totalCmv, cmvId, feeAmount, feePercentage);

        return SettlementResult.builder()
                .orderId(orderId)
                .revenueId(revenue.getId())
                .cmvId(cmvId)
                .feeId(feeId)
                .totalCmv(totalCmv)
                .feeAmount(feeId == null ? BigDecimal.ZERO : feeAmount)
                .alreadySettled(false)
                .build();
    }

    private Optional<SettlementResult> findExisting(long orderId, TransactionContext tx) {
        return ledgerStore.findRelated(MovementType.REVENUE, LedgerCategories.RELATED_ORDER, orderId, tx)
                .map(revenue -> {
                    Optional<FinancialMovement> cmv = ledgerStore.findRelated(
                            MovementType.CMV, LedgerCategories.RELATED_ORDER, orderId, tx);
                    Optional<FinancialMovement> fee = ledgerStore.findRelated(
                            MovementType.EXPENSE, LedgerCategories.RELATED_ORDER, orderId, tx);
                    return SettlementResult.builder()
                            .orderId(orderId)
                            .revenueId(revenue.getId())
                            .cmvId(cmv.map(FinancialMovement::getId).orElse(null))
                            .feeId(fee.map(FinancialMovement::getId).orElse(null))
                            .totalCmv(cmv.map(FinancialMovement::getValue).orElse(BigDecimal.ZERO))
                            .feeAmount(fee.map(FinancialMovement::getValue).orElse(BigDecimal.ZERO))
                            .alreadySettled(true)
                            .build();
                });
    }
}
