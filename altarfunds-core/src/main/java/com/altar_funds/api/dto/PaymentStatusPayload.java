package com.altar_funds.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

// Not wrapped in an envelope by the backend
public record PaymentStatusPayload(
        String status,
        String message,
        @JsonProperty("transaction_id") String transactionId,
        BigDecimal amount,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("processed_at") String processedAt
) {}
