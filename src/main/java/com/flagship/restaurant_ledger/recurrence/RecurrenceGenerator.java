package com.flagship.restaurant_ledger.recurrence;

import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;
import com.flagship.restaurant_ledger.common.tx.TransactionRunner;
import com.flagship.restaurant_ledger.ledger.FinancialMovement;
import com.flagship.restaurant_ledger.ledger.LedgerCategories;
import com.flagship.restaurant_ledger.ledger.MovementRecorder;
import com.flagship.restaurant_ledger.ledger.MovementType;
import com.flagship.restaurant_ledger.ledger.NewMovement;
import com.flagship.restaurant_ledger.ledger.PaymentStatus;
import com.flagship.restaurant_ledger.observability.LedgerMetrics;
import com.flagship.restaurant_ledger.recurrence.dto.GenerationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Generates the Pending movements that active recurrence rules owe for a
 * period.
 *
 * Generation is idempotent: a rule gets at most one movement per period, so
 * re-running a processed period only reports skips. One failing rule is
 * rolled back on its own and does not stop the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecurrenceGenerator {

    private final TransactionRunner transactionRunner;
    private final RecurrenceRuleRepository ruleRepository;
    private final MovementRecorder movementRecorder;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public GenerationReport generate() {
        return generate(null, null, null);
    }

    /**
     * @param year  calendar year for monthly and yearly rules, and week-based
     *              year for weekly rules; defaults to today's
     * @param month 1-12, defaults to the current month
     * @param week  ISO week 1-53; defaults to the current week, or to the week
     *              the target month starts in when only the year is given
     */
    public GenerationReport generate(Integer year, Integer month, Integer week) {
        LocalDate today = LocalDate.now(clock);
        int targetYear = year != null ? year : today.getYear();
        int targetMonth = month != null ? month : today.getMonthValue();
        int weekBasedYear = year != null ? year : today.get(IsoFields.WEEK_BASED_YEAR);

        if (targetMonth < 1 || targetMonth > 12) {
            throw new LedgerException(ErrorCode.INVALID_PERIOD, "Month must be between 1 and 12: " + targetMonth);
        }
        int targetWeek = week != null ? week : defaultWeek(year, targetMonth, today);
        if (targetWeek < 1 || targetWeek > RecurrenceSchedule.weeksIn(weekBasedYear)) {
            throw new LedgerException(ErrorCode.INVALID_PERIOD,
                    "Week must be between 1 and " + RecurrenceSchedule.weeksIn(weekBasedYear) + ": " + targetWeek);
        }

        log.info("Generating recurring movements: year={}, month={}, week={}-W{}",
                targetYear, targetMonth, weekBasedYear, targetWeek);

        GenerationReport report = transactionRunner.inTransaction(tx -> {
            int generated = 0;
            int skipped = 0;
            List<GenerationReport.RuleFailure> errors = new ArrayList<>();

            for (RecurrenceRule rule : ruleRepository.findAll(true, tx)) {
                try {
                    RecurrenceSchedule.DuePeriod period = RecurrenceSchedule.forRule(
                            rule, targetYear, targetMonth, weekBasedYear, targetWeek);
                    Optional<FinancialMovement> movement = tx.savepoint(
                            () -> movementRecorder.recordRecurring(movementFor(rule, period), rule.getCreatedBy(), tx));
                    if (movement.isPresent()) {
                        generated++;
                        log.debug("Rule {} generated movement {} for {}",
                                rule.getId(), movement.get().getId(), period.getPeriodKey());
                    } else {
                        skipped++;
                        log.debug("Rule {} already generated {}", rule.getId(), period.getPeriodKey());
                    }
                } catch (RuntimeException e) {
                    log.warn("Recurrence rule {} ({}) failed: {}", rule.getId(), rule.getName(), e.getMessage());
                    errors.add(new GenerationReport.RuleFailure(rule.getId(), rule.getName(), e.getMessage()));
                }
            }

            return GenerationReport.builder()
                    .generatedCount(generated)
                    .skippedCount(skipped)
                    .errors(errors)
                    .build();
        });

        metrics.recordRecurrence(report.getGeneratedCount(), report.getSkippedCount(), report.getErrors().size());
        log.info("Recurring generation done: generated={}, skipped={}, failed={}",
                report.getGeneratedCount(), report.getSkippedCount(), report.getErrors().size());
        return report;
    }

    /**
     * Week used when none is requested. Without a year it is today's week.
     * With a year it is the week holding the 1st of the target month, or week 1
     * when that day still belongs to the previous week-based year; today's week
     * could be 53 and not exist in the requested year.
     */
    static int defaultWeek(Integer year, int month, LocalDate today) {
        if (year == null) {
            return today.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        }
        LocalDate monthStart = LocalDate.of(year, month, 1);
        return monthStart.get(IsoFields.WEEK_BASED_YEAR) == year
                ? monthStart.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR)
                : 1;
    }

    static NewMovement movementFor(RecurrenceRule rule, RecurrenceSchedule.DuePeriod period) {
        String category = rule.getCategory() != null
                ? rule.getCategory()
                : (rule.getType() == MovementType.TAX ? LedgerCategories.TAXES : LedgerCategories.FIXED_COSTS);
        String description = rule.getDescription() != null
                ? rule.getDescription()
                : rule.getName() + " - " + rule.getRecurrenceType().name();

        return NewMovement.builder()
                .type(rule.getType())
                .value(rule.getValue())
                .category(category)
                .subcategory(rule.getSubcategory() != null ? rule.getSubcategory() : rule.getName())
                .description(description)
                .movementDate(period.getDueDate().atStartOfDay())
                .paymentStatus(PaymentStatus.PENDING)
                .senderReceiver(rule.getSenderReceiver())
                .relatedEntityType(LedgerCategories.RELATED_RECURRENCE_RULE)
                .relatedEntityId(rule.getId())
                .recurrencePeriodKey(period.getPeriodKey())
                .notes(rule.getNotes())
                .build();
    }
}
