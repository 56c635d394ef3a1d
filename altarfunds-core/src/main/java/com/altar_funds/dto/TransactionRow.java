package com.altar_funds.dto;

import com.altar_funds.model.TransactionStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

@Builder
public record TransactionRow(
        @JsonProperty("id") String id,
        @JsonProperty("category") String category,
        @JsonProperty("amount") String amount,
        @JsonProperty("date") String date,
        @JsonProperty("status") TransactionStatus status,
        @JsonProperty("status_label") String statusLabel
) {}
