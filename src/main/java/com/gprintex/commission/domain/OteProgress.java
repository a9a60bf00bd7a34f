package com.gprintex.commission.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Realized base commission of an AE in a calendar year, measured against the plan cap.
 */
public record OteProgress(
    Long aeId,
    int year,
    BigDecimal realizedBase,
    BigDecimal pendingBase,
    Optional<BigDecimal> annualCap
) {
    public OteProgress {
        realizedBase = Money.round(realizedBase);
        pendingBase = Money.round(pendingBase);
        annualCap = annualCap != null ? annualCap.filter(cap -> cap.signum() > 0) : Optional.empty();
    }

    public boolean capReached() {
        return annualCap.map(cap -> realizedBase.compareTo(cap) >= 0).orElse(false);
    }

    public Optional<BigDecimal> remainingBeforeCap() {
        return annualCap.map(cap -> Money.round(cap.subtract(realizedBase).max(BigDecimal.ZERO)));
    }

    public Optional<BigDecimal> percentOfCap() {
        return annualCap.map(cap -> realizedBase.multiply(BigDecimal.valueOf(100))
            .divide(cap, 2, RoundingMode.HALF_UP));
    }
}
