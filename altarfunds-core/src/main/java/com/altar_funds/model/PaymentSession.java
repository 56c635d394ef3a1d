package com.altar_funds.model;

import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * One user-initiated gift on its way through the payment provider. Mutations are synchronized;
 * every state change goes through {@link PaymentState#canMoveTo}.
 */
@Slf4j
@Getter
@ToString
public class PaymentSession {

    private final BigDecimal amount;
    private final String category;

    private volatile PaymentState state = PaymentState.DRAFT;
    private volatile Integer churchId;
    private volatile String reference;
    private volatile String redirectUrl;
    private volatile GivingTransaction transaction;
    private volatile String failureMessage;
    private volatile boolean verificationInFlight;

    private PaymentSession(BigDecimal amount, String category) {
        this.amount = amount;
        this.category = category;
    }

    public static PaymentSession draft(BigDecimal amount, String category) {
        return new PaymentSession(amount, category);
    }

    public synchronized void submit(int churchId) {
        moveTo(PaymentState.SUBMITTING);
        this.churchId = churchId;
    }

    public synchronized void awaitExternalConfirmation(String reference, String redirectUrl) {
        moveTo(PaymentState.AWAITING_EXTERNAL_CONFIRMATION);
        this.reference = reference;
        this.redirectUrl = redirectUrl;
    }

    public synchronized void failSubmission(String message) {
        moveTo(PaymentState.FAILED);
        this.failureMessage = message;
    }

    /**
     * @return false if a verification is already running for this session
     */
    public synchronized boolean beginVerification() {
        if (verificationInFlight) {
            return false;
        }
        moveTo(PaymentState.VERIFYING);
        verificationInFlight = true;
        return true;
    }

    public synchronized void complete(GivingTransaction resolved) {
        moveTo(PaymentState.COMPLETED);
        this.transaction = resolved;
    }

    public synchronized void decline(GivingTransaction resolved, String message) {
        moveTo(PaymentState.FAILED);
        this.transaction = resolved;
        this.failureMessage = message;
    }

    /** Clears the in-flight flag; an unresolved session goes back to waiting on the provider. */
    public synchronized void endVerification() {
        verificationInFlight = false;
        if (state == PaymentState.VERIFYING) {
            moveTo(PaymentState.AWAITING_EXTERNAL_CONFIRMATION);
        }
    }

    private void moveTo(PaymentState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Payment session " + reference + " cannot move from " + state + " to " + next);
        }
        log.debug("Payment session {}: {} -> {}", reference, state, next);
        state = next;
    }
}
