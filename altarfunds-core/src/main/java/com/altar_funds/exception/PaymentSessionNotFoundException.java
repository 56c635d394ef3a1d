package com.altar_funds.exception;

public class PaymentSessionNotFoundException extends PaymentException {
    public PaymentSessionNotFoundException(String reference) {
        super("No payment session with reference " + reference);
    }
}
