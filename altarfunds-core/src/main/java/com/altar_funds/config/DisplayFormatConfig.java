package com.altar_funds.config;

import com.altar_funds.format.CurrencyFormatter;
import com.altar_funds.format.IsoTransactionDateFormatter;
import com.altar_funds.format.LocaleCurrencyFormatter;
import com.altar_funds.format.TransactionDateFormatter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Currency;
import java.util.Locale;

@Configuration
public class DisplayFormatConfig {

    @Bean
    public CurrencyFormatter currencyFormatter(AltarFundsProperties props) {
        AltarFundsProperties.Display display = props.getDisplay();
        return new LocaleCurrencyFormatter(
                Locale.forLanguageTag(display.getLocale()),
                Currency.getInstance(display.getCurrencyCode()));
    }

    @Bean
    public TransactionDateFormatter transactionDateFormatter(AltarFundsProperties props) {
        AltarFundsProperties.Display display = props.getDisplay();
        return new IsoTransactionDateFormatter(display.getDatePattern(), Locale.forLanguageTag(display.getLocale()));
    }
}
