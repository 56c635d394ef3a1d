package com.altar_funds.model;

import com.altar_funds.api.dto.RemotePledge;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A promise to give {@code targetAmount} by {@code targetDate}. Progress is always derived.
 * The backend does not stop {@code amountPaid} from passing the target, so progress may exceed 100.
 */
public record Pledge(
        String id,
        String description,
        BigDecimal targetAmount,
        BigDecimal amountPaid,
        String targetDate
) {
    public Pledge {
        if (targetAmount == null) targetAmount = BigDecimal.ZERO;
        if (amountPaid == null) amountPaid = BigDecimal.ZERO;
    }

    public int progressPercent() {
        if (targetAmount.signum() <= 0) {
            return 0;
        }
        return amountPaid.multiply(BigDecimal.valueOf(100))
                .divide(targetAmount, 0, RoundingMode.DOWN)
                .intValue();
    }

    public boolean fulfilled() {
        return targetAmount.signum() > 0 && amountPaid.compareTo(targetAmount) >= 0;
    }

    public BigDecimal remaining() {
        return targetAmount.subtract(amountPaid).max(BigDecimal.ZERO);
    }

    public static Pledge from(RemotePledge remote) {
        return new Pledge(remote.id(), remote.description(), remote.amount(), remote.amountPaid(), remote.targetDate());
    }
}
