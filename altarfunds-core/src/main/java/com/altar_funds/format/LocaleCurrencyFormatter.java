package com.altar_funds.format;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.Currency;
import java.util.Locale;

public class LocaleCurrencyFormatter implements CurrencyFormatter {

    private final Locale locale;
    private final Currency currency;

    public LocaleCurrencyFormatter(Locale locale, Currency currency) {
        this.locale = locale;
        this.currency = currency;
    }

    @Override
    public String format(BigDecimal amount) {
        // NumberFormat is not thread safe
        NumberFormat nf = NumberFormat.getCurrencyInstance(locale);
        nf.setCurrency(currency);
        return nf.format(amount == null ? BigDecimal.ZERO : amount);
    }
}
