package com.gprintex.commission.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Commission plan - immutable once persisted.
 * Editing a plan creates a new version row that supersedes the previous one.
 */
public record CommissionConfig(
    Optional<Long> id,
    String name,
    ConfigStatus status,
    BigDecimal baseCommissionRate,
    BigDecimal pilotBonusRate,
    BigDecimal multiYearBonusRate,
    BigDecimal upfrontBonusRate,
    Optional<BigDecimal> annualCapAmount,
    BigDecimal decelerationRate,
    Optional<BigDecimal> highValueThreshold,
    Optional<BigDecimal> highValueRate,
    int version,
    Optional<Long> supersedesId,
    Optional<LocalDateTime> createdAt,
    Optional<String> createdBy
) {
    public static final String SYSTEM_DEFAULT_NAME = "System Default";

    public CommissionConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (baseCommissionRate == null) {
            throw new IllegalArgumentException("baseCommissionRate is required");
        }
        status = status != null ? status : ConfigStatus.ACTIVE;
        pilotBonusRate = pilotBonusRate != null ? pilotBonusRate : BigDecimal.ZERO;
        multiYearBonusRate = multiYearBonusRate != null ? multiYearBonusRate : BigDecimal.ZERO;
        upfrontBonusRate = upfrontBonusRate != null ? upfrontBonusRate : BigDecimal.ZERO;
        decelerationRate = decelerationRate != null ? decelerationRate : BigDecimal.ONE;
        requireRate("baseCommissionRate", baseCommissionRate);
        requireRate("pilotBonusRate", pilotBonusRate);
        requireRate("multiYearBonusRate", multiYearBonusRate);
        requireRate("upfrontBonusRate", upfrontBonusRate);
        requireRate("decelerationRate", decelerationRate);
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1");
        }
        id = id != null ? id : Optional.empty();
        annualCapAmount = annualCapAmount != null ? annualCapAmount : Optional.empty();
        highValueThreshold = highValueThreshold != null ? highValueThreshold : Optional.empty();
        highValueRate = highValueRate != null ? highValueRate : Optional.empty();
        supersedesId = supersedesId != null ? supersedesId : Optional.empty();
        createdAt = createdAt != null ? createdAt : Optional.empty();
        createdBy = createdBy != null ? createdBy : Optional.empty();
        annualCapAmount.ifPresent(cap -> {
            if (cap.signum() < 0) {
                throw new IllegalArgumentException("annualCapAmount must not be negative");
            }
        });
        highValueRate.ifPresent(rate -> requireRate("highValueRate", rate));
    }

    private static void requireRate(String field, BigDecimal rate) {
        if (rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException(field + " must be between 0 and 1");
        }
    }

    /**
     * Factory for a new, unsaved plan with only a base rate.
     */
    public static CommissionConfig draft(String name, BigDecimal baseCommissionRate) {
        return new CommissionConfig(
            Optional.empty(),
            name,
            ConfigStatus.ACTIVE,
            baseCommissionRate,
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            Optional.empty(),
            BigDecimal.ONE,
            Optional.empty(),
            Optional.empty(),
            1,
            Optional.empty(),
            Optional.empty(),
            Optional.empty()
        );
    }

    /**
     * The fallback plan applied when an AE has no assignment: base rate only, no bonuses, no cap.
     */
    public static CommissionConfig systemDefault(BigDecimal baseCommissionRate) {
        return draft(SYSTEM_DEFAULT_NAME, baseCommissionRate);
    }

    /**
     * Zero or absent cap means uncapped.
     */
    public boolean isCapped() {
        return annualCapAmount.filter(cap -> cap.signum() > 0).isPresent();
    }

    public boolean isActive() {
        return status == ConfigStatus.ACTIVE;
    }

    /**
     * Copy of this plan as the next version, superseding this one. The caller supplies the new figures.
     */
    public CommissionConfig nextVersion(CommissionConfig changes, String user, LocalDateTime createdAt) {
        var previousId = id.orElseThrow(() -> new IllegalStateException("Only a persisted config can be versioned"));
        return new CommissionConfig(
            Optional.empty(),
            changes.name(),
            ConfigStatus.ACTIVE,
            changes.baseCommissionRate(),
            changes.pilotBonusRate(),
            changes.multiYearBonusRate(),
            changes.upfrontBonusRate(),
            changes.annualCapAmount(),
            changes.decelerationRate(),
            changes.highValueThreshold(),
            changes.highValueRate(),
            version + 1,
            Optional.of(previousId),
            Optional.ofNullable(createdAt),
            Optional.ofNullable(user)
        );
    }

    public CommissionConfig withId(Long newId) {
        return new CommissionConfig(
            Optional.ofNullable(newId), name, status, baseCommissionRate, pilotBonusRate,
            multiYearBonusRate, upfrontBonusRate, annualCapAmount, decelerationRate,
            highValueThreshold, highValueRate, version, supersedesId, createdAt, createdBy
        );
    }

    public CommissionConfig withStatus(ConfigStatus newStatus) {
        return new CommissionConfig(
            id, name, newStatus, baseCommissionRate, pilotBonusRate,
            multiYearBonusRate, upfrontBonusRate, annualCapAmount, decelerationRate,
            highValueThreshold, highValueRate, version, supersedesId, createdAt, createdBy
        );
    }

    public CommissionConfig withCap(BigDecimal cap, BigDecimal deceleration) {
        return new CommissionConfig(
            id, name, status, baseCommissionRate, pilotBonusRate,
            multiYearBonusRate, upfrontBonusRate, Optional.ofNullable(cap), deceleration,
            highValueThreshold, highValueRate, version, supersedesId, createdAt, createdBy
        );
    }

    public CommissionConfig withBonusRates(BigDecimal pilot, BigDecimal multiYear, BigDecimal upfront) {
        return new CommissionConfig(
            id, name, status, baseCommissionRate, pilot,
            multiYear, upfront, annualCapAmount, decelerationRate,
            highValueThreshold, highValueRate, version, supersedesId, createdAt, createdBy
        );
    }

    public CommissionConfig withHighValueTier(BigDecimal threshold, BigDecimal rate) {
        return new CommissionConfig(
            id, name, status, baseCommissionRate, pilotBonusRate,
            multiYearBonusRate, upfrontBonusRate, annualCapAmount, decelerationRate,
            Optional.ofNullable(threshold), Optional.ofNullable(rate), version, supersedesId, createdAt, createdBy
        );
    }
}
