package com.altar_funds.exception;

/**
 * Rejected user input. Raised before any network call is made.
 */
public class GivingValidationException extends PaymentException {
    public GivingValidationException(String message) { super(message); }
}
