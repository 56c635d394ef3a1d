package com.altar_funds.model;

import java.util.Locale;

public enum TransactionStatus {
    PENDING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public String label() {
        return name().charAt(0) + name().substring(1).toLowerCase(Locale.ROOT);
    }

    /**
     * Maps the backend's status vocabulary. Anything not known to be final is treated as still
     * pending, so an unexpected value can never end a payment on its own.
     */
    public static TransactionStatus fromRemote(String status) {
        if (status == null) {
            return PENDING;
        }
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "completed", "success" -> COMPLETED;
            case "failed", "cancelled", "expired" -> FAILED;
            default -> PENDING;
        };
    }
}
