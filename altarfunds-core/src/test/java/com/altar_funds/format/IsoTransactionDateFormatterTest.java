package com.altar_funds.format;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.format.DateTimeParseException;
import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

class IsoTransactionDateFormatterTest {

    private final IsoTransactionDateFormatter formatter = new IsoTransactionDateFormatter("MMM dd, yyyy", Locale.ENGLISH);

    @ParameterizedTest
    @ValueSource(strings = {
            "2024-03-01",
            "2024-03-01T10:15:30",
            "2024-03-01T10:15:30.123456",
            "2024-03-01T10:15:30Z",
            "2024-03-01T10:15:30+03:00"
    })
    void acceptsBackendShapes(String raw) {
        assertThat(formatter.format(raw)).isEqualTo("Mar 01, 2024");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "01/03/2024", "2024-13-01", "not a date"})
    void rejectsEverythingElse(String raw) {
        assertThatThrownBy(() -> formatter.format(raw)).isInstanceOf(DateTimeParseException.class);
    }
}
