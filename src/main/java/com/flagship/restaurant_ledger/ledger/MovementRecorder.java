package com.flagship.restaurant_ledger.ledger;

import com.flagship.restaurant_ledger.cache.LedgerCache;
import com.flagship.restaurant_ledger.common.Strings;
import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;
import com.flagship.restaurant_ledger.common.tx.TransactionContext;
import com.flagship.restaurant_ledger.event.EventPublisher;
import com.flagship.restaurant_ledger.event.MovementCreatedEvent;
import com.flagship.restaurant_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Validates and inserts movements on a caller's transaction.
 *
 * Shared by the ledger API, invoice processing, order settlement and
 * recurrence generation, so every movement passes the same checks:
 * - type and description are required
 * - value rounds to a strictly positive amount of cents
 * - status defaults to PENDING; PAID without a date is dated now
 *
 * Cache invalidation and the created event are deferred until commit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MovementRecorder {

    private final LedgerStore ledgerStore;
    private final LedgerCache ledgerCache;
    private final EventPublisher eventPublisher;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public FinancialMovement record(NewMovement movement, Long userId, TransactionContext tx) {
        NewMovement prepared = prepare(movement);
        long id = ledgerStore.insert(prepared, userId, tx);
        FinancialMovement saved = load(id, tx);
        announce(saved, tx);
        log.info("Recorded movement: id={}, type={}, value={}, status={}",
                id, saved.getType(), saved.getValue(), saved.getPaymentStatus().getLabel());
        return saved;
    }

    /**
     * Records a recurrence-generated movement unless its period already has one.
     */
    public Optional<FinancialMovement> recordRecurring(NewMovement movement, Long userId, TransactionContext tx) {
        NewMovement prepared = prepare(movement);
        if (prepared.getRecurrencePeriodKey() == null || prepared.getRelatedEntityId() == null) {
            throw new IllegalArgumentException("Recurring movements need a rule id and a period key");
        }
        return ledgerStore.insertRecurring(prepared, userId, tx)
                .map(id -> {
                    FinancialMovement saved = load(id, tx);
                    announce(saved, tx);
                    return saved;
                });
    }

    /**
     * Applies defaults and validation without touching the database.
     */
    public NewMovement prepare(NewMovement movement) {
        if (movement.getType() == null) {
            throw new LedgerException(ErrorCode.INVALID_TYPE, "Movement type is required");
        }
        BigDecimal value = requirePositiveValue(movement.getValue());
        if (movement.getDescription() == null || movement.getDescription().isBlank()) {
            throw new LedgerException(ErrorCode.INVALID_DESCRIPTION);
        }

        PaymentStatus status = movement.getPaymentStatus() == null
                ? PaymentStatus.PENDING
                : movement.getPaymentStatus();
        LocalDateTime movementDate = movement.getMovementDate();
        if (status == PaymentStatus.PAID && movementDate == null) {
            movementDate = LocalDateTime.now(clock);
        }

        return movement.toBuilder()
                .value(value)
                .description(movement.getDescription().trim())
                .category(Strings.blankToNull(movement.getCategory()))
                .subcategory(Strings.blankToNull(movement.getSubcategory()))
                .paymentStatus(status)
                .movementDate(movementDate)
                .build();
    }

    /**
     * Rounds to cents and rejects anything that is not strictly positive.
     */
    public static BigDecimal requirePositiveValue(BigDecimal value) {
        if (value == null) {
            throw new LedgerException(ErrorCode.INVALID_VALUE, "Value is required");
        }
        BigDecimal rounded = value.setScale(2, RoundingMode.HALF_UP);
        if (rounded.signum() <= 0) {
            throw new LedgerException(ErrorCode.INVALID_VALUE, "Value must be greater than zero: " + value);
        }
        return rounded;
    }

    /**
     * Schedules the post-commit side effects of a movement change.
     */
    public void invalidateAfterCommit(TransactionContext tx) {
        tx.afterCommit("invalidate ledger cache", ledgerCache::invalidateLedger);
    }

    private void announce(FinancialMovement saved, TransactionContext tx) {
        invalidateAfterCommit(tx);
        tx.afterCommit("publish " + MovementCreatedEvent.EVENT_TYPE, () -> {
            eventPublisher.publish(MovementCreatedEvent.from(saved));
            metrics.recordMovementCreated(saved.getType().name());
        });
    }

    private FinancialMovement load(long id, TransactionContext tx) {
        return ledgerStore.findById(id, tx)
                .orElseThrow(() -> new IllegalStateException("Inserted movement not found: " + id));
    }
}
