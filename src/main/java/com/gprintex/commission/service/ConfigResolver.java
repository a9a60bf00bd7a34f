package com.gprintex.commission.service;

import com.gprintex.commission.config.CommissionProperties;
import com.gprintex.commission.domain.CommissionAssignment;
import com.gprintex.commission.domain.CommissionConfig;
import com.gprintex.commission.domain.ConfigResolution;
import com.gprintex.commission.domain.IntegrityWarning;
import com.gprintex.commission.exception.ConfigNotFoundException;
import com.gprintex.commission.repository.AssignmentRepository;
import com.gprintex.commission.repository.CommissionConfigRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Optional;

/**
 * Selects the commission plan that applies to an AE on a given date.
 */
@Service
public class ConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(ConfigResolver.class);

    private static final Comparator<CommissionAssignment> LATEST_FIRST =
        Comparator.comparing(CommissionAssignment::effectiveDate)
            .thenComparing(a -> a.id().orElse(0L))
            .reversed();

    private final AssignmentRepository assignments;
    private final CommissionConfigRepository configs;
    private final CommissionProperties properties;

    public ConfigResolver(
        AssignmentRepository assignments,
        CommissionConfigRepository configs,
        CommissionProperties properties
    ) {
        this.assignments = assignments;
        this.configs = configs;
        this.properties = properties;
    }

    /**
     * Resolve the plan for (aeId, onDate).
     * <p>
     * An assignment applies when effectiveDate &lt;= onDate &lt; endDate (or no end). Without one, the system
     * default plan is used if enabled. Overlapping assignments are a data error: the latest effective date
     * wins and an integrity warning is attached and logged.
     *
     * @throws ConfigNotFoundException when neither an assignment nor a default plan is available
     */
    @Transactional(readOnly = true)
    public ConfigResolution resolve(Long aeId, LocalDate onDate) {
        return findResolution(aeId, onDate).orElseThrow(() -> {
            log.warn("No commission assignment for AE {} on {} and the system default is disabled", aeId, onDate);
            return new ConfigNotFoundException(aeId, onDate);
        });
    }

    /**
     * Non-throwing form of {@link #resolve}.
     */
    @Transactional(readOnly = true)
    public Optional<ConfigResolution> findResolution(Long aeId, LocalDate onDate) {
        var covering = assignments.findCovering(aeId, onDate).stream()
            .filter(a -> a.covers(onDate))
            .sorted(LATEST_FIRST)
            .toList();

        if (covering.isEmpty()) {
            return defaultConfig().map(config -> {
                log.info("No commission assignment for AE {} on {}, falling back to '{}' at rate {}",
                    aeId, onDate, config.name(), config.baseCommissionRate());
                return ConfigResolution.fallback(config);
            });
        }

        var chosen = covering.get(0);
        var config = configs.findById(chosen.configId())
            .orElseThrow(() -> new ConfigNotFoundException(chosen.configId()));
        var resolution = ConfigResolution.assigned(config, chosen.id().orElse(null));

        if (covering.size() > 1) {
            var warning = IntegrityWarning.overlappingAssignments(
                aeId, onDate, covering.stream().map(a -> a.id().orElse(null)).toList());
            log.warn("Integrity warning [{}]: {}; using assignment {} effective {}",
                warning.code(), warning.message(), chosen.id().orElse(null), chosen.effectiveDate());
            return Optional.of(resolution.withWarning(warning));
        }
        return Optional.of(resolution);
    }

    /**
     * The system default plan, when enabled.
     */
    public Optional<CommissionConfig> defaultConfig() {
        var defaults = properties.defaults();
        if (!defaults.enabled()) {
            return Optional.empty();
        }
        return Optional.of(CommissionConfig.systemDefault(defaults.baseRate()));
    }
}
