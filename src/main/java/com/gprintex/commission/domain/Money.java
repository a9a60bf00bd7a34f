package com.gprintex.commission.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Currency helpers. All persisted and exposed amounts carry two decimals, rounded HALF_UP.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Money() {
    }

    public static BigDecimal round(BigDecimal amount) {
        return amount == null ? ZERO : amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * amount * rate, rounded to currency precision.
     */
    public static BigDecimal percentOf(BigDecimal amount, BigDecimal rate) {
        if (amount == null || rate == null) {
            return ZERO;
        }
        return round(amount.multiply(rate));
    }

    public static BigDecimal requireNonNegative(String field, BigDecimal amount) {
        if (amount == null) {
            return ZERO;
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException(field + " must not be negative: " + amount.toPlainString());
        }
        return round(amount);
    }
}
