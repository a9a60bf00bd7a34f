package com.gprintex.commission.exception;

import com.gprintex.commission.domain.CommissionStatus;

/**
 * The commission figures, or the contract/invoice behind them, can no longer change.
 */
public class CommissionLockedException extends CommissionException {

    private final CommissionStatus status;

    public CommissionLockedException(String message, CommissionStatus status) {
        super("COMMISSION_LOCKED", message);
        this.status = status;
    }

    public CommissionStatus getStatus() {
        return status;
    }
}
