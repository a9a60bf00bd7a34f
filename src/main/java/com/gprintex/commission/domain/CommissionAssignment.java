package com.gprintex.commission.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Time-bounded link between an AE and a commission plan.
 * The interval is half-open: [effectiveDate, endDate), with an absent endDate meaning open-ended.
 */
public record CommissionAssignment(
    Optional<Long> id,
    Long aeId,
    Long configId,
    LocalDate effectiveDate,
    Optional<LocalDate> endDate,
    Optional<LocalDateTime> createdAt,
    Optional<String> createdBy
) {
    public CommissionAssignment {
        if (aeId == null) {
            throw new IllegalArgumentException("aeId is required");
        }
        if (configId == null) {
            throw new IllegalArgumentException("configId is required");
        }
        if (effectiveDate == null) {
            throw new IllegalArgumentException("effectiveDate is required");
        }
        id = id != null ? id : Optional.empty();
        endDate = endDate != null ? endDate : Optional.empty();
        createdAt = createdAt != null ? createdAt : Optional.empty();
        createdBy = createdBy != null ? createdBy : Optional.empty();
        var start = effectiveDate;
        endDate.ifPresent(end -> {
            if (!end.isAfter(start)) {
                throw new IllegalArgumentException("endDate must be after effectiveDate");
            }
        });
    }

    public static CommissionAssignment open(Long aeId, Long configId, LocalDate effectiveDate) {
        return new CommissionAssignment(
            Optional.empty(), aeId, configId, effectiveDate,
            Optional.empty(), Optional.empty(), Optional.empty()
        );
    }

    /**
     * effectiveDate &lt;= date &lt; endDate (or no end).
     */
    public boolean covers(LocalDate date) {
        return !date.isBefore(effectiveDate) && endDate.map(date::isBefore).orElse(true);
    }

    public boolean isOpenEnded() {
        return endDate.isEmpty();
    }

    /**
     * Two half-open intervals overlap when each starts before the other ends.
     */
    public boolean overlaps(CommissionAssignment other) {
        boolean thisStartsBeforeOtherEnds = other.endDate.map(effectiveDate::isBefore).orElse(true);
        boolean otherStartsBeforeThisEnds = endDate.map(other.effectiveDate::isBefore).orElse(true);
        return thisStartsBeforeOtherEnds && otherStartsBeforeThisEnds;
    }

    public CommissionAssignment withId(Long newId) {
        return new CommissionAssignment(Optional.ofNullable(newId), aeId, configId, effectiveDate, endDate, createdAt, createdBy);
    }

    public CommissionAssignment withEndDate(LocalDate newEndDate) {
        return new CommissionAssignment(id, aeId, configId, effectiveDate, Optional.ofNullable(newEndDate), createdAt, createdBy);
    }
}
