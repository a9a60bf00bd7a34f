package com.gprintex.commission.exception;

import com.gprintex.commission.domain.CommissionStatus;

/**
 * Requested status change is not in the transition table. Nothing was changed.
 */
public class InvalidTransitionException extends CommissionException {

    private final Long commissionId;
    private final CommissionStatus from;
    private final CommissionStatus to;

    public InvalidTransitionException(Long commissionId, CommissionStatus from, CommissionStatus to) {
        super("INVALID_TRANSITION", "Commission " + commissionId + " cannot move from "
            + (from == null ? "null" : from.wireValue()) + " to " + (to == null ? "null" : to.wireValue()));
        this.commissionId = commissionId;
        this.from = from;
        this.to = to;
    }

    public Long getCommissionId() {
        return commissionId;
    }

    public CommissionStatus getFrom() {
        return from;
    }

    public CommissionStatus getTo() {
        return to;
    }
}
