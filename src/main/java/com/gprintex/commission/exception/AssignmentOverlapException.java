package com.gprintex.commission.exception;

import java.time.LocalDate;

/**
 * A new assignment would leave the AE with two plans active on the same day.
 */
public class AssignmentOverlapException extends CommissionException {

    private final Long aeId;
    private final Long conflictingAssignmentId;

    public AssignmentOverlapException(Long aeId, Long conflictingAssignmentId, LocalDate effectiveDate) {
        super("ASSIGNMENT_OVERLAP", "Assignment for AE " + aeId + " effective " + effectiveDate
            + " overlaps assignment " + conflictingAssignmentId);
        this.aeId = aeId;
        this.conflictingAssignmentId = conflictingAssignmentId;
    }

    public Long getAeId() {
        return aeId;
    }

    public Long getConflictingAssignmentId() {
        return conflictingAssignmentId;
    }
}
