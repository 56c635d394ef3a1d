package com.altar_funds.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RecentTransactions(
        @JsonProperty("transactions") List<TransactionRow> transactions,
        @JsonProperty("no_data") boolean noData
) {
    public static RecentTransactions of(List<TransactionRow> rows) {
        return new RecentTransactions(List.copyOf(rows), rows.isEmpty());
    }

    public static RecentTransactions empty() {
        return new RecentTransactions(List.of(), true);
    }
}
