package com.altar_funds.service;

import com.altar_funds.dto.TransactionRow;
import com.altar_funds.format.CurrencyFormatter;
import com.altar_funds.format.TransactionDateFormatter;
import com.altar_funds.model.GivingTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns transactions into display rows, keeping the input order.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TransactionListProjection {

    static final String DEFAULT_CATEGORY = "General";

    private final CurrencyFormatter currencyFormatter;
    private final TransactionDateFormatter dateFormatter;

    public List<TransactionRow> project(List<GivingTransaction> transactions) {
        return transactions.stream()
                .map(this::toRow)
                .toList();
    }

    public TransactionRow toRow(GivingTransaction txn) {
        return TransactionRow.builder()
                .id(txn.id())
                .category(txn.categoryName() == null || txn.categoryName().isBlank()
                        ? DEFAULT_CATEGORY
                        : txn.categoryName())
                .amount(currencyFormatter.format(txn.amount()))
                .date(displayDate(txn.date()))
                .status(txn.status())
                .statusLabel(txn.status().label())
                .build();
    }

    private String displayDate(String raw) {
        if (raw == null) {
            return "";
        }
        try {
            return dateFormatter.format(raw);
        } catch (RuntimeException e) {
            log.debug("Showing unparseable transaction date '{}' as is: {}", raw, e.getMessage());
            return raw;
        }
    }
}
