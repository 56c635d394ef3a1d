package com.altar_funds.format;

public interface TransactionDateFormatter {

    /**
     * Formats a backend date string for display.
     *
     * @throws java.time.format.DateTimeParseException if the value is not a recognised timestamp
     */
    String format(String rawDate);
}
