package com.gprintex.commission.domain;

import java.math.BigDecimal;

/**
 * Bonus amounts of one commission. Bonuses are never subject to the OTE cap.
 */
public record BonusBreakdown(
    BigDecimal pilotBonus,
    BigDecimal multiYearBonus,
    BigDecimal upfrontBonus
) {
    public BonusBreakdown {
        pilotBonus = Money.requireNonNegative("pilotBonus", pilotBonus);
        multiYearBonus = Money.requireNonNegative("multiYearBonus", multiYearBonus);
        upfrontBonus = Money.requireNonNegative("upfrontBonus", upfrontBonus);
    }

    public static BonusBreakdown none() {
        return new BonusBreakdown(Money.ZERO, Money.ZERO, Money.ZERO);
    }

    public BigDecimal total() {
        return pilotBonus.add(multiYearBonus).add(upfrontBonus);
    }
}
