package com.altar_funds.model;

import java.util.EnumSet;
import java.util.Set;

public enum PaymentState {
    DRAFT,
    SUBMITTING,
    AWAITING_EXTERNAL_CONFIRMATION,
    VERIFYING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canMoveTo(PaymentState next) {
        return successors().contains(next);
    }

    private Set<PaymentState> successors() {
        return switch (this) {
            case DRAFT -> EnumSet.of(SUBMITTING);
            case SUBMITTING -> EnumSet.of(AWAITING_EXTERNAL_CONFIRMATION, FAILED);
            case AWAITING_EXTERNAL_CONFIRMATION -> EnumSet.of(VERIFYING);
            // back to AWAITING when a check was inconclusive or abandoned
            case VERIFYING -> EnumSet.of(COMPLETED, FAILED, AWAITING_EXTERNAL_CONFIRMATION);
            case COMPLETED, FAILED -> EnumSet.noneOf(PaymentState.class);
        };
    }
}
