package com.gprintex.commission.repository;

import com.gprintex.commission.domain.CapCountingPolicy;
import com.gprintex.commission.domain.Commission;
import com.gprintex.commission.domain.CommissionDetails;
import com.gprintex.commission.domain.CommissionStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.List;
import java.util.Set;

/**
 * Repository for commission records. One row per invoice, enforced by a unique constraint.
 */
public interface CommissionRepository {

    // ========================================================================
    // INSERT / UPDATE
    // ========================================================================

    /**
     * Insert a new commission.
     * @throws org.springframework.dao.DuplicateKeyException when the invoice already has one
     */
    Commission insert(Commission commission);

    /**
     * Compare-and-set status change: applies only while the stored status still equals {@code expected}.
     * @return false when another request moved the commission first
     */
    boolean updateStatus(Commission commission, CommissionStatus expected);

    /**
     * Overwrite the computed figures of a commission that is still pending.
     * @return false when the commission is no longer pending
     */
    boolean updateFigures(Commission commission);

    // ========================================================================
    // QUERY OPERATIONS
    // ========================================================================

    Optional<Commission> findById(Long id);

    Optional<Commission> findByInvoiceId(Long invoiceId);

    List<CommissionDetails> findByFilter(CommissionFilter filter);

    /**
     * Sum of stored base commission for the AE over invoices dated in the calendar year,
     * restricted to the given statuses.
     */
    BigDecimal sumBaseCommission(Long aeId, int year, Set<CommissionStatus> statuses);

    default BigDecimal sumApprovedBaseCommission(Long aeId, int year) {
        return sumBaseCommission(aeId, year, CapCountingPolicy.REALIZED_ONLY.countedStatuses());
    }

    /**
     * True when any invoice of the contract carries an approved or paid commission.
     */
    boolean existsLockedForContract(Long contractId);

    // ========================================================================
    // FILTER RECORD
    // ========================================================================

    record CommissionFilter(
        Optional<Long> aeId,
        Optional<CommissionStatus> status,
        Optional<LocalDate> fromDate,
        Optional<LocalDate> toDate
    ) {
        public static CommissionFilter all() {
            return new CommissionFilter(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
        }

        public CommissionFilter withAe(Long id) {
            return new CommissionFilter(Optional.ofNullable(id), status, fromDate, toDate);
        }

        public CommissionFilter withStatus(CommissionStatus s) {
            return new CommissionFilter(aeId, Optional.ofNullable(s), fromDate, toDate);
        }

        /**
         * Invoice date range, both ends inclusive.
         */
        public CommissionFilter withDateRange(LocalDate from, LocalDate to) {
            return new CommissionFilter(aeId, status, Optional.ofNullable(from), Optional.ofNullable(to));
        }
    }
}
