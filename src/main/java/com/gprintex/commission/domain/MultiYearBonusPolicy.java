package com.gprintex.commission.domain;

import java.math.BigDecimal;

/**
 * How the multi-year bonus scales with contract length.
 */
public enum MultiYearBonusPolicy {
    /**
     * amount * rate once for any contract longer than a year.
     */
    FLAT,
    /**
     * amount * rate for each year beyond the first.
     */
    PER_ADDITIONAL_YEAR;

    public BigDecimal multiplier(int contractLength) {
        if (contractLength <= 1) {
            return BigDecimal.ZERO;
        }
        return switch (this) {
            case FLAT -> BigDecimal.ONE;
            case PER_ADDITIONAL_YEAR -> BigDecimal.valueOf(contractLength - 1L);
        };
    }
}
