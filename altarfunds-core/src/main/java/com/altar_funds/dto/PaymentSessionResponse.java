package com.altar_funds.dto;

import com.altar_funds.model.PaymentSession;
import com.altar_funds.model.PaymentState;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record PaymentSessionResponse(
        @JsonProperty("reference") String reference,
        @JsonProperty("redirect_url") String redirectUrl,
        @JsonProperty("state") PaymentState state,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("category") String category,
        @JsonProperty("church_id") Integer churchId
) {
    public static PaymentSessionResponse from(PaymentSession session) {
        return PaymentSessionResponse.builder()
                .reference(session.getReference())
                .redirectUrl(session.getRedirectUrl())
                .state(session.getState())
                .amount(session.getAmount())
                .category(session.getCategory())
                .churchId(session.getChurchId())
                .build();
    }
}
