package com.gprintex.commission.service;

import com.gprintex.commission.config.CommissionProperties;
import com.gprintex.commission.domain.CapCountingPolicy;
import com.gprintex.commission.domain.CapResult;
import com.gprintex.commission.domain.Commission;
import com.gprintex.commission.domain.CommissionConfig;
import com.gprintex.commission.domain.Money;
import com.gprintex.commission.repository.CapLedgerRepository;
import com.gprintex.commission.repository.CommissionRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * Applies the cumulative annual OTE cap to base commission.
 * <p>
 * Full rate up to the cap, {@code decelerationRate} on everything beyond it. The running total is the
 * stored base commission of the AE for invoices dated in the same calendar year, counted per
 * {@link CapCountingPolicy}.
 */
@Component
public class OteCapTracker {

    private final CommissionRepository commissions;
    private final CapLedgerRepository ledger;
    private final CapCountingPolicy countingPolicy;

    public OteCapTracker(CommissionRepository commissions, CapLedgerRepository ledger, CommissionProperties properties) {
        this.commissions = commissions;
        this.ledger = ledger;
        this.countingPolicy = properties.ote().countingPolicy();
    }

    /**
     * Lock the (aeId, year) ledger row, read the running total and apply the cap.
     * Joins the caller's transaction; the lock is released when it ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CapResult applyCap(Long aeId, int year, BigDecimal proposedBaseAmount, CommissionConfig config) {
        if (!config.isCapped()) {
            return CapResult.uncapped(proposedBaseAmount);
        }
        ledger.lock(aeId, year);
        return cap(runningTotal(aeId, year), proposedBaseAmount, config);
    }

    /**
     * Re-run the cap for a commission that is already stored, leaving its own base out of the running total.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CapResult reapplyCap(Long aeId, int year, BigDecimal proposedBaseAmount, CommissionConfig config, Commission current) {
        if (!config.isCapped()) {
            return CapResult.uncapped(proposedBaseAmount);
        }
        ledger.lock(aeId, year);
        var running = runningTotal(aeId, year);
        if (countingPolicy.countedStatuses().contains(current.status())) {
            running = running.subtract(current.baseCommission()).max(BigDecimal.ZERO);
        }
        return cap(running, proposedBaseAmount, config);
    }

    /**
     * Same as {@link #applyCap} but against the realized total only, used to settle a commission at approval.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CapResult settleOnApproval(Long aeId, int year, BigDecimal grossBaseAmount, CommissionConfig config) {
        if (!config.isCapped()) {
            return CapResult.uncapped(grossBaseAmount);
        }
        ledger.lock(aeId, year);
        return cap(commissions.sumApprovedBaseCommission(aeId, year), grossBaseAmount, config);
    }

    public BigDecimal runningTotal(Long aeId, int year) {
        return commissions.sumBaseCommission(aeId, year, countingPolicy.countedStatuses());
    }

    public CapCountingPolicy countingPolicy() {
        return countingPolicy;
    }

    /**
     * Piecewise cap: full amount below the cap, decelerated amount above it, split when the proposal crosses it.
     */
    public static CapResult cap(BigDecimal runningTotal, BigDecimal proposed, CommissionConfig config) {
        if (!config.isCapped()) {
            return CapResult.uncapped(proposed);
        }
        var capAmount = config.annualCapAmount().orElseThrow();
        var deceleration = config.decelerationRate();

        if (runningTotal.add(proposed).compareTo(capAmount) <= 0) {
            return CapResult.uncapped(proposed);
        }
        if (runningTotal.compareTo(capAmount) >= 0) {
            return CapResult.decelerated(Money.round(proposed.multiply(deceleration)));
        }
        var headroom = capAmount.subtract(runningTotal);
        var excess = proposed.subtract(headroom);
        return CapResult.decelerated(Money.round(headroom.add(excess.multiply(deceleration))));
    }
}
