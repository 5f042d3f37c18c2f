package com.flagship.restaurant_ledger.recurrence;

import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Year;
import java.time.YearMonth;
import java.time.temporal.IsoFields;

/**
 * Due dates and period keys of recurrence rules. Days past the end of the
 * period are clamped to its last day.
 */
public final class RecurrenceSchedule {

    private RecurrenceSchedule() {
    }

    @Value
    public static class DuePeriod {
        LocalDate dueDate;
        String periodKey;
    }

    /** Day of month, e.g. day 31 of February 2026 is 2026-02-28, key {@code 2026-02}. */
    public static DuePeriod monthly(int year, int month, int day) {
        YearMonth yearMonth = YearMonth.of(year, month);
        LocalDate due = yearMonth.atDay(Math.min(day, yearMonth.lengthOfMonth()));
        return new DuePeriod(due, String.format("%04d-%02d", year, month));
    }

    /** ISO weekday of an ISO week, key {@code 2026-W42}. */
    public static DuePeriod weekly(int weekBasedYear, int week, int dayOfWeek) {
        LocalDate monday = LocalDate.of(weekBasedYear, 1, 4)
                .with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, week)
                .with(DayOfWeek.MONDAY);
        return new DuePeriod(monday.plusDays(dayOfWeek - 1L), String.format("%04d-W%02d", weekBasedYear, week));
    }

    /** Day of year, key {@code 2026}. */
    public static DuePeriod yearly(int year, int dayOfYear) {
        LocalDate due = Year.of(year).atDay(Math.min(dayOfYear, Year.of(year).length()));
        return new DuePeriod(due, String.format("%04d", year));
    }

    public static int weeksIn(int weekBasedYear) {
        return (int) LocalDate.of(weekBasedYear, 1, 4).range(IsoFields.WEEK_OF_WEEK_BASED_YEAR).getMaximum();
    }

    public static DuePeriod forRule(RecurrenceRule rule, int year, int month, int weekBasedYear, int week) {
        switch (rule.getRecurrenceType()) {
            case MONTHLY:
                return monthly(year, month, rule.getRecurrenceDay());
            case WEEKLY:
                return weekly(weekBasedYear, week, rule.getRecurrenceDay());
            case YEARLY:
                return yearly(year, rule.getRecurrenceDay());
            default:
                throw new IllegalArgumentException("Unsupported recurrence type: " + rule.getRecurrenceType());
        }
    }
}
