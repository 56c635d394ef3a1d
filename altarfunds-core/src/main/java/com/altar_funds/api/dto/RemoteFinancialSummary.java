package com.altar_funds.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record RemoteFinancialSummary(
        @JsonProperty("total_income") BigDecimal totalIncome,
        @JsonProperty("total_expenses") BigDecimal totalExpenses,
        @JsonProperty("net_income") BigDecimal netIncome
) {}
