package com.gprintex.commission.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which commission statuses count toward the OTE running total.
 */
public enum CapCountingPolicy {
    /**
     * Approved and paid only. The cap applied at calculation is provisional and settled at approval.
     */
    REALIZED_ONLY(EnumSet.of(CommissionStatus.APPROVED, CommissionStatus.PAID)),
    /**
     * Pending, approved and paid. The cap applied at calculation is final.
     */
    INCLUDE_PENDING(EnumSet.of(CommissionStatus.PENDING, CommissionStatus.APPROVED, CommissionStatus.PAID));

    private final Set<CommissionStatus> countedStatuses;

    CapCountingPolicy(Set<CommissionStatus> countedStatuses) {
        this.countedStatuses = countedStatuses;
    }

    public Set<CommissionStatus> countedStatuses() {
        return EnumSet.copyOf(countedStatuses);
    }

    public boolean settlesOnApproval() {
        return this == REALIZED_ONLY;
    }
}
