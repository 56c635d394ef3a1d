package com.altar_funds.format;

import java.math.BigDecimal;

public interface CurrencyFormatter {

    /** Renders an amount for display; a null amount renders as zero. */
    String format(BigDecimal amount);
}
