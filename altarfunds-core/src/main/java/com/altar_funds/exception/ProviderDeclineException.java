package com.altar_funds.exception;

import lombok.Getter;

/**
 * The backend confirmed that the payment failed. Terminal.
 */
@Getter
public class ProviderDeclineException extends PaymentException {

    private final String reference;

    public ProviderDeclineException(String reference, String providerMessage) {
        super(providerMessage == null || providerMessage.isBlank()
                ? "Payment " + reference + " was declined"
                : "Payment " + reference + " was declined: " + providerMessage);
        this.reference = reference;
    }
}
