package com.gprintex.commission.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * Data-integrity problem detected during resolution. Logged, never fatal.
 */
public record IntegrityWarning(
    String code,
    Long aeId,
    LocalDate onDate,
    List<Long> assignmentIds,
    String message
) {
    public static final String OVERLAPPING_ASSIGNMENTS = "OVERLAPPING_ASSIGNMENTS";

    public IntegrityWarning {
        assignmentIds = assignmentIds != null ? List.copyOf(assignmentIds) : List.of();
    }

    public static IntegrityWarning overlappingAssignments(Long aeId, LocalDate onDate, List<Long> assignmentIds) {
        return new IntegrityWarning(
            OVERLAPPING_ASSIGNMENTS, aeId, onDate, assignmentIds,
            "AE " + aeId + " has " + assignmentIds.size() + " assignments covering " + onDate
        );
    }
}
