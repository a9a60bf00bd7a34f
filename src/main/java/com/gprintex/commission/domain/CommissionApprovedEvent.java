package com.gprintex.commission.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Published when a commission is approved. Consumers run after the approving transaction commits.
 */
public record CommissionApprovedEvent(
    Long commissionId,
    Long aeId,
    BigDecimal totalCommission,
    String approvedBy,
    LocalDateTime approvedAt
) {
    public static CommissionApprovedEvent of(Commission commission) {
        return new CommissionApprovedEvent(
            commission.id().orElseThrow(() -> new IllegalArgumentException("Commission has no id")),
            commission.aeId(),
            commission.totalCommission(),
            commission.approvedBy().orElse(null),
            commission.approvedAt().orElse(null)
        );
    }
}
