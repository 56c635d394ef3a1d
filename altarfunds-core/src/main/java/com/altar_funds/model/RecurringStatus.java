package com.altar_funds.model;

public enum RecurringStatus {
    ACTIVE,
    PAUSED;

    public static RecurringStatus fromRemote(String value) {
        return "active".equalsIgnoreCase(value) ? ACTIVE : PAUSED;
    }
}
