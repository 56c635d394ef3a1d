package com.altar_funds.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record PaymentSessionRequest(
        BigDecimal amount,
        String category,
        @JsonProperty("church_id") int churchId
) {}
