package com.altar_funds.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record RemoteRecurringGiving(
        String id,
        @JsonProperty("category_name") String categoryName,
        BigDecimal amount,
        String frequency,
        @JsonProperty("next_payment_date") String nextPaymentDate,
        String status         // active | paused
) {}
