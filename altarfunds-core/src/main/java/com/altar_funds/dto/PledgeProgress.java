package com.altar_funds.dto;

import com.altar_funds.model.Pledge;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record PledgeProgress(
        @JsonProperty("id") String id,
        @JsonProperty("description") String description,
        @JsonProperty("target_amount") BigDecimal targetAmount,
        @JsonProperty("amount_paid") BigDecimal amountPaid,
        @JsonProperty("remaining") BigDecimal remaining,
        @JsonProperty("target_date") String targetDate,
        @JsonProperty("progress_percent") int progressPercent,
        @JsonProperty("fulfilled") boolean fulfilled
) {
    public static PledgeProgress from(Pledge pledge) {
        return new PledgeProgress(
                pledge.id(),
                pledge.description(),
                pledge.targetAmount(),
                pledge.amountPaid(),
                pledge.remaining(),
                pledge.targetDate(),
                pledge.progressPercent(),
                pledge.fulfilled());
    }
}
