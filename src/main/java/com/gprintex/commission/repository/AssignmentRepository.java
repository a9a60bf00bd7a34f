package com.gprintex.commission.repository;

import com.gprintex.commission.domain.CommissionAssignment;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Time-bounded AE to plan assignments.
 */
public interface AssignmentRepository {

    CommissionAssignment insert(CommissionAssignment assignment);

    Optional<CommissionAssignment> findById(Long id);

    /**
     * All assignments of the AE whose half-open interval contains the date.
     * More than one row means the data violates the no-overlap rule.
     */
    List<CommissionAssignment> findCovering(Long aeId, LocalDate onDate);

    List<CommissionAssignment> findByAe(Long aeId);

    /**
     * Assignments pointing at a config that are still open or end after the date.
     */
    List<CommissionAssignment> findActiveForConfig(Long configId, LocalDate fromDate);

    boolean setEndDate(Long assignmentId, LocalDate endDate);

    /**
     * Re-point an assignment that has not started yet at another config.
     */
    boolean updateConfig(Long assignmentId, Long configId);
}
