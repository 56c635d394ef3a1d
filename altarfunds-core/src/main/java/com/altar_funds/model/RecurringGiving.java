package com.altar_funds.model;

import com.altar_funds.api.dto.RemoteRecurringGiving;
import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record RecurringGiving(
        String id,
        String categoryName,
        BigDecimal amount,
        Frequency frequency,
        String nextPaymentDate,
        RecurringStatus status
) {
    public static RecurringGiving from(RemoteRecurringGiving remote) {
        return RecurringGiving.builder()
                .id(remote.id())
                .categoryName(remote.categoryName() == null ? "General Giving" : remote.categoryName())
                .amount(remote.amount())
                .frequency(Frequency.fromRemote(remote.frequency()))
                .nextPaymentDate(remote.nextPaymentDate())
                .status(RecurringStatus.fromRemote(remote.status()))
                .build();
    }
}
