package com.altar_funds.model;

import com.altar_funds.api.dto.RemoteFinancialSummary;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record FinancialSummary(
        @JsonProperty("total_income") BigDecimal totalIncome,
        @JsonProperty("total_expenses") BigDecimal totalExpenses,
        @JsonProperty("net_income") BigDecimal netIncome
) {
    public static final FinancialSummary ZERO =
            new FinancialSummary(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

    public static FinancialSummary from(RemoteFinancialSummary remote) {
        return new FinancialSummary(
                orZero(remote.totalIncome()),
                orZero(remote.totalExpenses()),
                orZero(remote.netIncome()));
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
