package com.altar_funds.model;

import com.altar_funds.api.dto.RemoteTransaction;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * One gift. The status moves from PENDING to COMPLETED or FAILED exactly once.
 */
@Builder(toBuilder = true)
public record GivingTransaction(
        String id,
        String categoryName,
        BigDecimal amount,
        String date,
        TransactionStatus status
) {
    public GivingTransaction {
        if (status == null) status = TransactionStatus.PENDING;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public GivingTransaction resolve(TransactionStatus outcome) {
        if (isTerminal()) {
            throw new IllegalStateException("Transaction " + id + " is already " + status);
        }
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("Cannot resolve transaction " + id + " to " + outcome);
        }
        return toBuilder().status(outcome).build();
    }

    public static GivingTransaction from(RemoteTransaction remote) {
        return GivingTransaction.builder()
                .id(remote.id())
                .categoryName(remote.categoryName())
                .amount(remote.amount())
                .date(remote.date())
                .status(TransactionStatus.fromRemote(remote.status()))
                .build();
    }

    public static GivingTransaction from(CachedTransaction cached) {
        return GivingTransaction.builder()
                .id(cached.getId())
                .categoryName(cached.getCategoryName())
                .amount(cached.getAmount())
                .date(cached.getDate())
                .status(cached.getStatus() == null ? TransactionStatus.PENDING : TransactionStatus.valueOf(cached.getStatus()))
                .build();
    }
}
