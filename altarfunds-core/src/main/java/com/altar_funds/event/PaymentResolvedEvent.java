package com.altar_funds.event;

import com.altar_funds.model.TransactionStatus;

/**
 * Published once a payment session reaches a terminal status.
 */
public record PaymentResolvedEvent(
        String reference,
        String transactionId,
        TransactionStatus status
) {}
