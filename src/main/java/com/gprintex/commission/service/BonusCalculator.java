package com.gprintex.commission.service;

import com.gprintex.commission.config.CommissionProperties;
import com.gprintex.commission.domain.BonusBreakdown;
import com.gprintex.commission.domain.CommissionConfig;
import com.gprintex.commission.domain.Contract;
import com.gprintex.commission.domain.Invoice;
import com.gprintex.commission.domain.Money;
import com.gprintex.commission.domain.MultiYearBonusPolicy;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Computes the pilot, multi-year and upfront bonuses of an invoice.
 * The rules are independent and may all apply; each amount is rounded on its own.
 */
@Component
public class BonusCalculator {

    private final MultiYearBonusPolicy multiYearPolicy;

    @Autowired
    public BonusCalculator(CommissionProperties properties) {
        this(properties.bonus().multiYearPolicy());
    }

    BonusCalculator(MultiYearBonusPolicy multiYearPolicy) {
        this.multiYearPolicy = multiYearPolicy;
    }

    public BonusBreakdown computeBonuses(Contract contract, Invoice invoice, CommissionConfig config) {
        var amount = invoice.amount();

        var pilot = contract.isPilot()
            ? Money.percentOf(amount, config.pilotBonusRate())
            : Money.ZERO;

        var multiYear = contract.isMultiYear()
            ? Money.percentOf(amount, config.multiYearBonusRate().multiply(multiYearPolicy.multiplier(contract.contractLength())))
            : Money.ZERO;

        var upfront = contract.paymentTerms().isUpfront()
            ? Money.percentOf(amount, config.upfrontBonusRate())
            : Money.ZERO;

        return new BonusBreakdown(pilot, multiYear, upfront);
    }

    /**
     * Base commission before the OTE cap, honouring the optional high-value tier:
     * when the contract value exceeds the threshold, the invoice amount above the threshold earns the tier rate.
     */
    public BigDecimal grossBaseCommission(Contract contract, Invoice invoice, CommissionConfig config) {
        var amount = invoice.amount();
        var threshold = config.highValueThreshold().orElse(null);
        var tierRate = config.highValueRate().orElse(null);
        if (threshold == null || tierRate == null || contract.totalValue().compareTo(threshold) <= 0) {
            return Money.percentOf(amount, config.baseCommissionRate());
        }
        var standardPortion = amount.min(threshold);
        var tierPortion = amount.subtract(standardPortion).max(BigDecimal.ZERO);
        return Money.round(standardPortion.multiply(config.baseCommissionRate())
            .add(tierPortion.multiply(tierRate)));
    }

    public MultiYearBonusPolicy multiYearPolicy() {
        return multiYearPolicy;
    }
}
