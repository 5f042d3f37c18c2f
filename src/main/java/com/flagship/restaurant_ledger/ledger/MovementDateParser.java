package com.flagship.restaurant_ledger.ledger;

import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;

/**
 * Parses the date formats accepted from back-office clients:
 * {@code DD-MM-YYYY}, {@code YYYY-MM-DD}, {@code YYYY-MM-DDTHH:MM[:SS[.fff]]}
 * and ISO date-times with an offset or {@code Z}, which are converted to the
 * local zone.
 */
public final class MovementDateParser {

    private static final Pattern DAY_FIRST = Pattern.compile("\\d{2}-\\d{2}-\\d{4}");
    private static final DateTimeFormatter DAY_FIRST_FORMAT =
            DateTimeFormatter.ofPattern("dd-MM-uuuu").withResolverStyle(ResolverStyle.STRICT);

    private MovementDateParser() {
    }

    /**
     * @return the parsed date-time, or null for a null or blank input
     * @throws LedgerException with INVALID_DATE for any other unparseable input
     */
    public static LocalDateTime parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        try {
            if (DAY_FIRST.matcher(text).matches()) {
                return LocalDate.parse(text, DAY_FIRST_FORMAT).atStartOfDay();
            }
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay();
            }
            if (text.endsWith("Z") || hasOffset(text)) {
                return OffsetDateTime.parse(text)
                        .atZoneSameInstant(ZoneId.systemDefault())
                        .toLocalDateTime();
            }
            return LocalDateTime.parse(text);
        } catch (DateTimeParseException e) {
            throw new LedgerException(ErrorCode.INVALID_DATE,
                    "Invalid date: " + value + ". Use DD-MM-YYYY or YYYY-MM-DD[THH:MM:SS]");
        }
    }

    public static LocalDate parseDate(String value) {
        LocalDateTime parsed = parse(value);
        return parsed == null ? null : parsed.toLocalDate();
    }

    private static boolean hasOffset(String text) {
        int timeStart = text.indexOf('T');
        if (timeStart < 0) {
            return false;
        }
        String time = text.substring(timeStart);
        return time.indexOf('+') > 0 || time.indexOf('-') > 0;
    }
}
