package com.altar_funds.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PaymentSessionCreated(
        String reference,
        @JsonProperty("redirect_url") String redirectUrl
) {}
