package com.gprintex.commission.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Commission earned on one invoice.
 * The total always equals base + pilot + multi-year + upfront at currency precision.
 */
public record Commission(
    Optional<Long> id,
    Long invoiceId,
    Long aeId,
    Optional<Long> configId,
    BigDecimal grossBaseCommission,
    BigDecimal baseCommission,
    BigDecimal pilotBonus,
    BigDecimal multiYearBonus,
    BigDecimal upfrontBonus,
    BigDecimal totalCommission,
    boolean oteApplied,
    CommissionStatus status,
    Optional<String> approvedBy,
    Optional<LocalDateTime> approvedAt,
    Optional<String> rejectionReason,
    Optional<String> paidBy,
    Optional<LocalDateTime> paidAt,
    Optional<LocalDateTime> createdAt,
    Optional<LocalDateTime> updatedAt
) {
    public Commission {
        if (invoiceId == null) {
            throw new IllegalArgumentException("invoiceId is required");
        }
        if (aeId == null) {
            throw new IllegalArgumentException("aeId is required");
        }
        baseCommission = Money.requireNonNegative("baseCommission", baseCommission);
        grossBaseCommission = grossBaseCommission != null
            ? Money.requireNonNegative("grossBaseCommission", grossBaseCommission)
            : baseCommission;
        pilotBonus = Money.requireNonNegative("pilotBonus", pilotBonus);
        multiYearBonus = Money.requireNonNegative("multiYearBonus", multiYearBonus);
        upfrontBonus = Money.requireNonNegative("upfrontBonus", upfrontBonus);
        var expectedTotal = baseCommission.add(pilotBonus).add(multiYearBonus).add(upfrontBonus);
        if (totalCommission == null) {
            totalCommission = expectedTotal;
        } else if (Money.round(totalCommission).compareTo(expectedTotal) != 0) {
            throw new IllegalArgumentException(
                "totalCommission " + totalCommission.toPlainString()
                    + " does not equal the sum of its components " + expectedTotal.toPlainString());
        } else {
            totalCommission = Money.round(totalCommission);
        }
        status = status != null ? status : CommissionStatus.PENDING;
        id = id != null ? id : Optional.empty();
        configId = configId != null ? configId : Optional.empty();
        approvedBy = approvedBy != null ? approvedBy : Optional.empty();
        approvedAt = approvedAt != null ? approvedAt : Optional.empty();
        rejectionReason = rejectionReason != null ? rejectionReason : Optional.empty();
        paidBy = paidBy != null ? paidBy : Optional.empty();
        paidAt = paidAt != null ? paidAt : Optional.empty();
        createdAt = createdAt != null ? createdAt : Optional.empty();
        updatedAt = updatedAt != null ? updatedAt : Optional.empty();
    }

    /**
     * Factory for a freshly calculated, pending commission.
     */
    public static Commission pending(
        Long invoiceId, Long aeId, Long configId,
        BigDecimal grossBase, CapResult cap, BonusBreakdown bonuses, LocalDateTime createdAt
    ) {
        return new Commission(
            Optional.empty(), invoiceId, aeId, Optional.ofNullable(configId),
            grossBase, cap.cappedAmount(),
            bonuses.pilotBonus(), bonuses.multiYearBonus(), bonuses.upfrontBonus(),
            null, cap.oteApplied(), CommissionStatus.PENDING,
            Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
            Optional.ofNullable(createdAt), Optional.empty()
        );
    }

    /**
     * Zero commission for revenue that does not earn commission.
     */
    public static Commission zero(Long invoiceId, Long aeId, Long configId, LocalDateTime createdAt) {
        return pending(invoiceId, aeId, configId, Money.ZERO, CapResult.uncapped(Money.ZERO), BonusBreakdown.none(), createdAt);
    }

    public boolean isPending() {
        return status == CommissionStatus.PENDING;
    }

    public boolean isLocked() {
        return status.isLocked();
    }

    public BonusBreakdown bonuses() {
        return new BonusBreakdown(pilotBonus, multiYearBonus, upfrontBonus);
    }

    public Commission withId(Long newId) {
        return new Commission(
            Optional.ofNullable(newId), invoiceId, aeId, configId, grossBaseCommission, baseCommission,
            pilotBonus, multiYearBonus, upfrontBonus, totalCommission, oteApplied, status,
            approvedBy, approvedAt, rejectionReason, paidBy, paidAt, createdAt, updatedAt
        );
    }

    /**
     * Copy with recomputed figures; status and audit fields are kept.
     */
    public Commission withFigures(Long newConfigId, BigDecimal grossBase, CapResult cap, BonusBreakdown newBonuses,
                                  LocalDateTime at) {
        return new Commission(
            id, invoiceId, aeId, Optional.ofNullable(newConfigId), grossBase, cap.cappedAmount(),
            newBonuses.pilotBonus(), newBonuses.multiYearBonus(), newBonuses.upfrontBonus(),
            null, cap.oteApplied(), status,
            approvedBy, approvedAt, rejectionReason, paidBy, paidAt, createdAt,
            Optional.ofNullable(at)
        );
    }

    /**
     * Copy with a settled base amount, used when the cap is applied again at approval.
     */
    public Commission withSettledBase(CapResult cap, LocalDateTime at) {
        return withFigures(configId.orElse(null), grossBaseCommission, cap, bonuses(), at);
    }

    public Commission approved(String user, LocalDateTime at) {
        status.requireTransitionTo(CommissionStatus.APPROVED, id.orElse(null));
        return new Commission(
            id, invoiceId, aeId, configId, grossBaseCommission, baseCommission,
            pilotBonus, multiYearBonus, upfrontBonus, totalCommission, oteApplied, CommissionStatus.APPROVED,
            Optional.ofNullable(user), Optional.of(at), rejectionReason, paidBy, paidAt, createdAt, Optional.of(at)
        );
    }

    public Commission rejected(String reason, LocalDateTime at) {
        status.requireTransitionTo(CommissionStatus.REJECTED, id.orElse(null));
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("rejectionReason is required to reject a commission");
        }
        return new Commission(
            id, invoiceId, aeId, configId, grossBaseCommission, baseCommission,
            pilotBonus, multiYearBonus, upfrontBonus, totalCommission, oteApplied, CommissionStatus.REJECTED,
            approvedBy, approvedAt, Optional.of(reason), paidBy, paidAt, createdAt, Optional.of(at)
        );
    }

    public Commission paid(String user, LocalDateTime at) {
        status.requireTransitionTo(CommissionStatus.PAID, id.orElse(null));
        return new Commission(
            id, invoiceId, aeId, configId, grossBaseCommission, baseCommission,
            pilotBonus, multiYearBonus, upfrontBonus, totalCommission, oteApplied, CommissionStatus.PAID,
            approvedBy, approvedAt, rejectionReason, Optional.ofNullable(user), Optional.of(at), createdAt, Optional.of(at)
        );
    }
}
