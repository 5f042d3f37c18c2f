package com.flagship.restaurant_ledger.recurrence;

import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;
import com.flagship.restaurant_ledger.ledger.LedgerCategories;
import com.flagship.restaurant_ledger.ledger.MovementType;
import com.flagship.restaurant_ledger.ledger.NewMovement;
import com.flagship.restaurant_ledger.ledger.PaymentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Due dates, period keys and the movement a rule produces.
 */
class RecurrenceScheduleTest {

    @Test
    @DisplayName("Monthly day past the end of the month is clamped")
    void testMonthlyClamp() {
        RecurrenceSchedule.DuePeriod february = RecurrenceSchedule.monthly(2026, 2, 31);
        assertEquals(LocalDate.of(2026, 2, 28), february.getDueDate());
        assertEquals("2026-02", february.getPeriodKey());

        assertEquals(LocalDate.of(2028, 2, 29), RecurrenceSchedule.monthly(2028, 2, 30).getDueDate());
        assertEquals(LocalDate.of(2026, 10, 10), RecurrenceSchedule.monthly(2026, 10, 10).getDueDate());
    }

    @Test
    @DisplayName("Without a requested week, a given year uses the week its target month starts in")
    void testDefaultWeek() {
        // 2026-12-31 is in 2026-W53; 2027 only has 52 weeks
        LocalDate lastWeekOf2026 = LocalDate.of(2026, 12, 31);

        assertEquals(53, RecurrenceGenerator.defaultWeek(null, 12, lastWeekOf2026));
        assertEquals(48, RecurrenceGenerator.defaultWeek(2027, 12, lastWeekOf2026));
        // 2027-01-01 still belongs to 2026-W53
        assertEquals(1, RecurrenceGenerator.defaultWeek(2027, 1, lastWeekOf2026));
        assertEquals(9, RecurrenceGenerator.defaultWeek(2026, 3, lastWeekOf2026));
    }

    @Test
    @DisplayName("Weekly rules fall on the ISO weekday of the ISO week")
    void testWeekly() {
        RecurrenceSchedule.DuePeriod monday = RecurrenceSchedule.weekly(2026, 42, 1);
        assertEquals(LocalDate.of(2026, 10, 12), monday.getDueDate());
        assertEquals("2026-W42", monday.getPeriodKey());

        assertEquals(LocalDate.of(2026, 10, 18), RecurrenceSchedule.weekly(2026, 42, 7).getDueDate());
        // ISO week 1 of 2026 starts on 29 December 2025
        assertEquals(LocalDate.of(2025, 12, 29), RecurrenceSchedule.weekly(2026, 1, 1).getDueDate());
        assertEquals("2026-W01", RecurrenceSchedule.weekly(2026, 1, 1).getPeriodKey());
    }

    @Test
    @DisplayName("Yearly rules fall on the given day of the year")
    void testYearly() {
        RecurrenceSchedule.DuePeriod period = RecurrenceSchedule.yearly(2026, 365);
        assertEquals(LocalDate.of(2026, 12, 31), period.getDueDate());
        assertEquals("2026", period.getPeriodKey());

        assertEquals(LocalDate.of(2028, 12, 30), RecurrenceSchedule.yearly(2028, 365).getDueDate());
        assertEquals(LocalDate.of(2026, 2, 1), RecurrenceSchedule.yearly(2026, 32).getDueDate());
    }

    @Test
    @DisplayName("Week-based years have 52 or 53 weeks")
    void testWeeksIn() {
        assertEquals(53, RecurrenceSchedule.weeksIn(2026));
        assertEquals(52, RecurrenceSchedule.weeksIn(2027));
    }

    @Test
    @DisplayName("Recurrence day ranges depend on the recurrence type")
    void testDayRanges() {
        assertTrue(RecurrenceType.MONTHLY.isValidDay(31));
        assertFalse(RecurrenceType.MONTHLY.isValidDay(32));
        assertTrue(RecurrenceType.WEEKLY.isValidDay(7));
        assertFalse(RecurrenceType.WEEKLY.isValidDay(0));
        assertTrue(RecurrenceType.YEARLY.isValidDay(365));
        assertFalse(RecurrenceType.YEARLY.isValidDay(366));
        assertFalse(RecurrenceType.YEARLY.isValidDay(null));

        LedgerException exception = assertThrows(LedgerException.class,
                () -> RecurrenceType.WEEKLY.requireValidDay(8));
        assertEquals(ErrorCode.INVALID_RECURRENCE_DAY, exception.getErrorCode());
        assertEquals(ErrorCode.INVALID_RECURRENCE_TYPE,
                assertThrows(LedgerException.class, () -> RecurrenceType.parse("daily")).getErrorCode());
        assertEquals(RecurrenceType.MONTHLY, RecurrenceType.parse("monthly"));
    }

    @Test
    @DisplayName("Generated movement uses rule defaults")
    void testMovementDefaults() {
        RecurrenceRule rule = RecurrenceRule.builder()
                .id(3L)
                .name("Municipal tax")
                .type(MovementType.TAX)
                .value(new BigDecimal("250.00"))
                .recurrenceType(RecurrenceType.MONTHLY)
                .recurrenceDay(10)
                .active(true)
                .build();

        NewMovement movement = RecurrenceGenerator.movementFor(rule, RecurrenceSchedule.monthly(2026, 10, 10));

        assertEquals(LedgerCategories.TAXES, movement.getCategory());
        assertEquals("Municipal tax", movement.getSubcategory());
        assertEquals("Municipal tax - MONTHLY", movement.getDescription());
        assertEquals(PaymentStatus.PENDING, movement.getPaymentStatus());
        assertEquals(LocalDate.of(2026, 10, 10).atStartOfDay(), movement.getMovementDate());
        assertEquals(LedgerCategories.RELATED_RECURRENCE_RULE, movement.getRelatedEntityType());
        assertEquals(3L, movement.getRelatedEntityId());
        assertEquals("2026-10", movement.getRecurrencePeriodKey());

        NewMovement rent = RecurrenceGenerator.movementFor(
                rule.toBuilder().type(MovementType.EXPENSE).name("Rent").build(),
                RecurrenceSchedule.monthly(2026, 10, 10));
        assertEquals(LedgerCategories.FIXED_COSTS, rent.getCategory());
    }
}
