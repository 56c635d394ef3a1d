package com.altar_funds.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

// validated in PaymentSessionManager
public record GiveRequest(
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("category") String category
) {}
