package com.gprintex.commission.service;

import com.gprintex.commission.domain.CommissionAssignment;
import com.gprintex.commission.domain.CommissionConfig;
import com.gprintex.commission.domain.ConfigStatus;
import com.gprintex.commission.domain.ValidationResult;
import com.gprintex.commission.exception.AssignmentOverlapException;
import com.gprintex.commission.exception.ConfigNotFoundException;
import com.gprintex.commission.exception.EntityNotFoundException;
import com.gprintex.commission.exception.ValidationException;
import com.gprintex.commission.repository.AccountExecutiveRepository;
import com.gprintex.commission.repository.AssignmentRepository;
import com.gprintex.commission.repository.CommissionConfigRepository;
import io.vavr.control.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Commission plan catalogue and AE assignments.
 * Plans are never edited in place: a change creates a new version and moves assignments over to it.
 */
@Service
public class CommissionConfigService {

    private static final Logger log = LoggerFactory.getLogger(CommissionConfigService.class);

    private final CommissionConfigRepository configs;
    private final AssignmentRepository assignments;
    private final AccountExecutiveRepository accountExecutives;
    private final Clock clock;

    public CommissionConfigService(
        CommissionConfigRepository configs,
        AssignmentRepository assignments,
        AccountExecutiveRepository accountExecutives,
        Clock clock
    ) {
        this.configs = configs;
        this.assignments = assignments;
        this.accountExecutives = accountExecutives;
        this.clock = clock;
    }

    // ========================================================================
    // CONFIGS
    // ========================================================================

    @Transactional
    public CommissionConfig create(CommissionConfig config, String user) {
        var toSave = new CommissionConfig(
            Optional.empty(), config.name(), ConfigStatus.ACTIVE, config.baseCommissionRate(),
            config.pilotBonusRate(), config.multiYearBonusRate(), config.upfrontBonusRate(),
            config.annualCapAmount(), config.decelerationRate(), config.highValueThreshold(),
            config.highValueRate(), 1, Optional.empty(), Optional.of(LocalDateTime.now(clock)), Optional.ofNullable(user)
        );
        var saved = configs.insert(toSave);
        log.info("Created commission config {} '{}' (base rate {})", saved.id().orElse(null), saved.name(), saved.baseCommissionRate());
        return saved;
    }

    /**
     * Create the next version of a config and re-point its assignments from {@code effectiveFrom} on.
     * Assignments starting on or after that date switch to the new version; running ones are split.
     */
    @Transactional
    public CommissionConfig newVersion(Long configId, CommissionConfig changes, LocalDate effectiveFrom, String user) {
        var current = configs.findById(configId)
            .orElseThrow(() -> new ConfigNotFoundException(configId));
        if (!current.isActive()) {
            throw new ValidationException(
                "CONFIG_INACTIVE", "Config " + configId + " is inactive and has been superseded", "configId");
        }
        var next = configs.insert(current.nextVersion(changes, user, LocalDateTime.now(clock)));
        var nextId = next.id().orElseThrow();
        configs.updateStatus(configId, ConfigStatus.INACTIVE);

        int repointed = 0;
        for (var assignment : assignments.findActiveForConfig(configId, effectiveFrom)) {
            var assignmentId = assignment.id().orElseThrow();
            if (!assignment.effectiveDate().isBefore(effectiveFrom)) {
                assignments.updateConfig(assignmentId, nextId);
            } else {
                assignments.setEndDate(assignmentId, effectiveFrom);
                assignments.insert(new CommissionAssignment(
                    Optional.empty(), assignment.aeId(), nextId, effectiveFrom, assignment.endDate(),
                    Optional.empty(), Optional.ofNullable(user)));
            }
            repointed++;
        }
        log.info("Config {} superseded by version {} (id {}) from {}, {} assignments re-pointed",
            configId, next.version(), nextId, effectiveFrom, repointed);
        return next;
    }

    @Transactional(readOnly = true)
    public Optional<CommissionConfig> findById(Long id) {
        return configs.findById(id);
    }

    @Transactional(readOnly = true)
    public List<CommissionConfig> findAll(Optional<ConfigStatus> status) {
        return configs.findAll(status);
    }

    // ========================================================================
    // ASSIGNMENTS
    // ========================================================================

    /**
     * Assign a config to an AE from {@code effectiveDate}. The AE's open-ended assignment that started earlier
     * is ended on that date; any other overlap is rejected.
     */
    @Transactional
    public Either<List<ValidationResult>, CommissionAssignment> assign(
        Long aeId, Long configId, LocalDate effectiveDate, Optional<LocalDate> endDate, String user
    ) {
        var errors = new ArrayList<ValidationResult>();
        if (!accountExecutives.exists(aeId)) {
            errors.add(ValidationResult.error("AE_NOT_FOUND", "Account executive " + aeId + " does not exist", "aeId"));
        }
        configs.findById(configId).ifPresentOrElse(
            config -> {
                if (!config.isActive()) {
                    errors.add(ValidationResult.error("CONFIG_INACTIVE", "Config " + configId + " is inactive", "configId"));
                }
            },
            () -> errors.add(ValidationResult.error("CONFIG_NOT_FOUND", "Config " + configId + " does not exist", "configId"))
        );
        if (endDate.isPresent() && !endDate.get().isAfter(effectiveDate)) {
            errors.add(ValidationResult.error("INVALID_INTERVAL", "endDate must be after effectiveDate", "endDate"));
        }
        if (!errors.isEmpty()) {
            return Either.left(errors);
        }

        var candidate = new CommissionAssignment(
            Optional.empty(), aeId, configId, effectiveDate, endDate, Optional.empty(), Optional.ofNullable(user));

        CommissionAssignment superseded = null;
        for (var existing : assignments.findByAe(aeId)) {
            if (existing.isOpenEnded() && existing.effectiveDate().isBefore(effectiveDate)) {
                superseded = existing;
                continue;
            }
            if (existing.overlaps(candidate)) {
                throw new AssignmentOverlapException(aeId, existing.id().orElse(null), effectiveDate);
            }
        }
        if (superseded != null) {
            assignments.setEndDate(superseded.id().orElseThrow(), effectiveDate);
            log.info("Assignment {} of AE {} ended on {}", superseded.id().orElse(null), aeId, effectiveDate);
        }
        var saved = assignments.insert(candidate);
        log.info("Assigned config {} to AE {} from {}{}", configId, aeId, effectiveDate,
            endDate.map(d -> " until " + d).orElse(""));
        return Either.right(saved);
    }

    @Transactional(readOnly = true)
    public List<CommissionAssignment> assignmentsOf(Long aeId) {
        if (!accountExecutives.exists(aeId)) {
            throw new EntityNotFoundException("Account executive", aeId);
        }
        return assignments.findByAe(aeId);
    }
}
