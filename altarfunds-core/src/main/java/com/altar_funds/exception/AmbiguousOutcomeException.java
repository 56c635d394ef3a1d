package com.altar_funds.exception;

import lombok.Getter;

/**
 * Verification ran out of attempts without seeing a terminal status. The payment may still
 * complete; callers must present this as "unknown, check again later".
 */
@Getter
public class AmbiguousOutcomeException extends PaymentException {

    private final String reference;
    private final long attempts;

    public AmbiguousOutcomeException(String reference, long attempts) {
        super("Outcome of payment " + reference + " is not known yet after " + attempts
                + " checks, check again later");
        this.reference = reference;
        this.attempts = attempts;
    }
}
