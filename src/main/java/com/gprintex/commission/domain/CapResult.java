package com.gprintex.commission.domain;

import java.math.BigDecimal;

/**
 * Base commission after the annual OTE cap.
 */
public record CapResult(
    BigDecimal cappedAmount,
    boolean oteApplied
) {
    public CapResult {
        cappedAmount = Money.requireNonNegative("cappedAmount", cappedAmount);
    }

    public static CapResult uncapped(BigDecimal amount) {
        return new CapResult(amount, false);
    }

    public static CapResult decelerated(BigDecimal amount) {
        return new CapResult(amount, true);
    }
}
