package com.altar_funds.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record RemoteTransaction(
        String id,
        @JsonProperty("category_name") String categoryName,
        BigDecimal amount,
        String date,          // kept raw, the backend is not consistent about the format
        String status,        // pending | processing | completed | success | failed | ...
        @JsonProperty("payment_method") String paymentMethod
) {}
