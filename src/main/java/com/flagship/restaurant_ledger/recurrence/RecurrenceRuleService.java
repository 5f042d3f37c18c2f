package com.flagship.restaurant_ledger.recurrence;

import com.flagship.restaurant_ledger.common.Strings;
import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;
import com.flagship.restaurant_ledger.common.tx.TransactionRunner;
import com.flagship.restaurant_ledger.ledger.MovementRecorder;
import com.flagship.restaurant_ledger.ledger.MovementType;
import com.flagship.restaurant_ledger.recurrence.dto.CreateRecurrenceRuleRequest;
import com.flagship.restaurant_ledger.recurrence.dto.UpdateRecurrenceRuleRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Maintains the rules that generate recurring expenses and taxes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecurrenceRuleService {

    private final TransactionRunner transactionRunner;
    private final RecurrenceRuleRepository ruleRepository;

    public RecurrenceRule createRule(CreateRecurrenceRuleRequest request, Long userId) {
        RecurrenceType recurrenceType = RecurrenceType.parse(request.getRecurrenceType());
        RecurrenceRule rule = RecurrenceRule.builder()
                .name(requireName(request.getName()))
                .description(Strings.blankToNull(request.getDescription()))
                .type(requireRuleType(request.getType()))
                .category(Strings.blankToNull(request.getCategory()))
                .subcategory(Strings.blankToNull(request.getSubcategory()))
                .value(MovementRecorder.requirePositiveValue(request.getValue()))
                .recurrenceType(recurrenceType)
                .recurrenceDay(request.getRecurrenceDay())
                .senderReceiver(Strings.blankToNull(request.getSenderReceiver()))
                .notes(request.getNotes())
                .active(true)
                .build();
        recurrenceType.requireValidDay(rule.getRecurrenceDay());

        return transactionRunner.inTransaction(tx -> {
            long id = ruleRepository.insert(rule, userId, tx);
            log.info("Created recurrence rule {}: {} {} on day {}, value={}",
                    id, rule.getName(), recurrenceType, rule.getRecurrenceDay(), rule.getValue());
            return ruleRepository.findById(id, tx)
                    .orElseThrow(() -> new IllegalStateException("Inserted rule not found: " + id));
        });
    }

    public List<RecurrenceRule> listRules(boolean activeOnly) {
        return transactionRunner.readOnly(tx -> ruleRepository.findAll(activeOnly, tx));
    }

    public RecurrenceRule getRule(long id) {
        return transactionRunner.readOnly(tx -> ruleRepository.findById(id, tx))
                .orElseThrow(() -> LedgerException.notFound("Recurrence rule", id));
    }

    /**
     * Applies a partial update; the recurrence day is validated against the
     * resulting recurrence type.
     */
    public RecurrenceRule updateRule(long id, UpdateRecurrenceRuleRequest request) {
        if (request == null || request.isEmpty()) {
            throw new LedgerException(ErrorCode.NO_UPDATES);
        }

        return transactionRunner.inTransaction(tx -> {
            RecurrenceRule existing = ruleRepository.findByIdForUpdate(id, tx)
                    .orElseThrow(() -> LedgerException.notFound("Recurrence rule", id));

            RecurrenceRule.RecurrenceRuleBuilder builder = existing.toBuilder();
            if (request.getName() != null) {
                builder.name(requireName(request.getName()));
            }
            if (request.getDescription() != null) {
                builder.description(Strings.blankToNull(request.getDescription()));
            }
            if (request.getType() != null) {
                builder.type(requireRuleType(request.getType()));
            }
            if (request.getCategory() != null) {
                builder.category(Strings.blankToNull(request.getCategory()));
            }
            if (request.getSubcategory() != null) {
                builder.subcategory(Strings.blankToNull(request.getSubcategory()));
            }
            if (request.getValue() != null) {
                builder.value(MovementRecorder.requirePositiveValue(request.getValue()));
            }
            if (request.getRecurrenceType() != null) {
                builder.recurrenceType(RecurrenceType.parse(request.getRecurrenceType()));
            }
            if (request.getRecurrenceDay() != null) {
                builder.recurrenceDay(request.getRecurrenceDay());
            }
            if (request.getSenderReceiver() != null) {
                builder.senderReceiver(Strings.blankToNull(request.getSenderReceiver()));
            }
            if (request.getNotes() != null) {
                builder.notes(request.getNotes());
            }
            if (request.getActive() != null) {
                builder.active(request.getActive());
            }

            RecurrenceRule updated = builder.build();
            updated.getRecurrenceType().requireValidDay(updated.getRecurrenceDay());
            ruleRepository.update(updated, tx);
            log.info("Updated recurrence rule {}", id);
            return ruleRepository.findById(id, tx).orElseThrow(() -> LedgerException.notFound("Recurrence rule", id));
        });
    }

    /**
     * Soft delete: the rule stops generating but its movements stay.
     */
    public void deactivateRule(long id) {
        transactionRunner.inTransaction(tx -> {
            if (ruleRepository.deactivate(id, tx) == 0) {
                throw LedgerException.notFound("Recurrence rule", id);
            }
            log.info("Deactivated recurrence rule {}", id);
            return null;
        });
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new LedgerException(ErrorCode.INVALID_NAME);
        }
        return name.trim();
    }

    private static MovementType requireRuleType(String value) {
        MovementType type = MovementType.parse(value);
        if (type != MovementType.EXPENSE && type != MovementType.TAX) {
            throw new LedgerException(ErrorCode.INVALID_TYPE, "Recurrence rules must be EXPENSE or TAX: " + value);
        }
        return type;
    }
}
