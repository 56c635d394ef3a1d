package com.altar_funds.model;

import java.util.Locale;

public enum Frequency {
    DAILY,
    WEEKLY,
    BI_WEEKLY,
    MONTHLY,
    QUARTERLY,
    ANNUALLY,
    UNKNOWN;

    public static Frequency fromRemote(String value) {
        if (value == null) return UNKNOWN;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "daily" -> DAILY;
            case "weekly" -> WEEKLY;
            case "biweekly", "bi_weekly", "bi-weekly" -> BI_WEEKLY;
            case "monthly" -> MONTHLY;
            case "quarterly" -> QUARTERLY;
            case "annually", "yearly" -> ANNUALLY;
            default -> UNKNOWN;
        };
    }
}
