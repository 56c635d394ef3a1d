package com.altar_funds.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record RemotePledge(
        String id,
        String description,
        BigDecimal amount,
        @JsonProperty("amount_paid") BigDecimal amountPaid,
        @JsonProperty("target_date") String targetDate
) {}
