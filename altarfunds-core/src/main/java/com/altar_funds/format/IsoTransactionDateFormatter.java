package com.altar_funds.format;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;

/**
 * Accepts the shapes the backend sends: full ISO timestamps with or without an offset
 * ({@code 2024-03-01T10:15:30}, {@code 2024-03-01T10:15:30Z}) and plain dates.
 */
public class IsoTransactionDateFormatter implements TransactionDateFormatter {

    private final DateTimeFormatter output;

    public IsoTransactionDateFormatter(String pattern, Locale locale) {
        this.output = DateTimeFormatter.ofPattern(pattern, locale);
    }

    @Override
    public String format(String rawDate) {
        if (rawDate == null || rawDate.isBlank()) {
            throw new DateTimeParseException("Empty date", String.valueOf(rawDate), 0);
        }
        String value = rawDate.trim();
        TemporalAccessor parsed = value.length() <= 10
                ? LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE)
                : DateTimeFormatter.ISO_DATE_TIME.parse(value);
        return output.format(LocalDate.from(parsed));
    }
}
