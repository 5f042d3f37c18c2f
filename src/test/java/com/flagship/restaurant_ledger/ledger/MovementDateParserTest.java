package com.flagship.restaurant_ledger.ledger;

import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class MovementDateParserTest {

    @Test
    @DisplayName("Day-first dates parse to midnight")
    void testDayFirst() {
        assertEquals(LocalDateTime.of(2026, 10, 17, 0, 0), MovementDateParser.parse("17-10-2026"));
    }

    @Test
    @DisplayName("ISO dates and date-times parse")
    void testIso() {
        assertEquals(LocalDateTime.of(2026, 10, 17, 0, 0), MovementDateParser.parse("2026-10-17"));
        assertEquals(LocalDateTime.of(2026, 10, 17, 14, 30), MovementDateParser.parse("2026-10-17T14:30"));
        assertEquals(LocalDateTime.of(2026, 10, 17, 14, 30, 15), MovementDateParser.parse(" 2026-10-17T14:30:15 "));
    }

    @Test
    @DisplayName("Date-times with an offset are converted to the local zone")
    void testOffset() {
        LocalDateTime expected = OffsetDateTime.parse("2026-10-17T12:00:00Z")
                .atZoneSameInstant(ZoneId.systemDefault())
                .toLocalDateTime();
        assertEquals(expected, MovementDateParser.parse("2026-10-17T12:00:00Z"));

        LocalDateTime withOffset = OffsetDateTime.parse("2026-10-17T09:00:00-03:00")
                .atZoneSameInstant(ZoneId.systemDefault())
                .toLocalDateTime();
        assertEquals(withOffset, MovementDateParser.parse("2026-10-17T09:00:00-03:00"));
    }

    @Test
    @DisplayName("Blank input means no date")
    void testBlank() {
        assertNull(MovementDateParser.parse(null));
        assertNull(MovementDateParser.parse("   "));
        assertNull(MovementDateParser.parseDate(""));
    }

    @Test
    @DisplayName("Impossible and malformed dates are INVALID_DATE")
    void testInvalid() {
        for (String input : new String[]{"31-02-2026", "2026/10/17", "yesterday", "2026-13-01"}) {
            LedgerException exception = assertThrows(LedgerException.class, () -> MovementDateParser.parse(input),
                    "Expected failure for " + input);
            assertEquals(ErrorCode.INVALID_DATE, exception.getErrorCode());
        }
    }

    @Test
    @DisplayName("parseDate drops the time of day")
    void testParseDate() {
        assertEquals(LocalDate.of(2026, 1, 5), MovementDateParser.parseDate("2026-01-05T23:59"));
    }
}
