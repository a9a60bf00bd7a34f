package com.gprintex.commission.api;

import com.gprintex.commission.domain.CommissionAssignment;
import com.gprintex.commission.domain.CommissionConfig;
import com.gprintex.commission.domain.ConfigStatus;
import com.gprintex.commission.exception.ValidationException;
import com.gprintex.commission.service.CommissionConfigService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.security.Principal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Admin API for commission plans and their assignment to account executives.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class CommissionConfigController {

    private final CommissionConfigService configService;

    public CommissionConfigController(CommissionConfigService configService) {
        this.configService = configService;
    }

    // ========================================================================
    // CONFIGS
    // ========================================================================

    @PostMapping("/configs")
    public ResponseEntity<CommissionConfig> create(
        @RequestBody ConfigRequest request,
        @RequestHeader(value = RequestUser.HEADER, required = false) String userId,
        Principal principal
    ) {
        var created = configService.create(request.toConfig(), RequestUser.resolve(userId, principal));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/configs")
    public List<CommissionConfig> list(@RequestParam(required = false) String status) {
        return configService.findAll(Optional.ofNullable(status).map(ConfigStatus::fromWire));
    }

    @GetMapping("/configs/{id}")
    public ResponseEntity<CommissionConfig> getById(@PathVariable Long id) {
        return configService.findById(id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Plans are never edited in place: a change creates a superseding version.
     */
    @PostMapping("/configs/{id}/versions")
    public ResponseEntity<CommissionConfig> newVersion(
        @PathVariable Long id,
        @RequestBody VersionRequest request,
        @RequestHeader(value = RequestUser.HEADER, required = false) String userId,
        Principal principal
    ) {
        if (request.config() == null) {
            throw new ValidationException("CONFIG_REQUIRED", "The new version's figures are required", "config");
        }
        var effectiveFrom = request.effectiveFrom() != null ? request.effectiveFrom() : LocalDate.now();
        var created = configService.newVersion(id, request.config().toConfig(), effectiveFrom,
            RequestUser.resolve(userId, principal));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    // ========================================================================
    // ASSIGNMENTS
    // ========================================================================

    @PostMapping("/assignments")
    public ResponseEntity<?> assign(
        @RequestBody AssignmentRequest request,
        @RequestHeader(value = RequestUser.HEADER, required = false) String userId,
        Principal principal
    ) {
        return configService.assign(request.aeId(), request.configId(), request.effectiveDate(),
                Optional.ofNullable(request.endDate()), RequestUser.resolve(userId, principal))
            .fold(
                errors -> ResponseEntity.badRequest().body(errors),
                created -> ResponseEntity.status(HttpStatus.CREATED).body(created)
            );
    }

    @GetMapping("/account-executives/{aeId}/assignments")
    public List<CommissionAssignment> assignments(@PathVariable Long aeId) {
        return configService.assignmentsOf(aeId);
    }

    public record ConfigRequest(
        String name,
        BigDecimal baseCommissionRate,
        BigDecimal pilotBonusRate,
        BigDecimal multiYearBonusRate,
        BigDecimal upfrontBonusRate,
        BigDecimal annualCapAmount,
        BigDecimal decelerationRate,
        BigDecimal highValueThreshold,
        BigDecimal highValueRate
    ) {
        CommissionConfig toConfig() {
            return CommissionConfig.draft(name, baseCommissionRate)
                .withBonusRates(pilotBonusRate, multiYearBonusRate, upfrontBonusRate)
                .withCap(annualCapAmount, decelerationRate)
                .withHighValueTier(highValueThreshold, highValueRate);
        }
    }

    public record VersionRequest(ConfigRequest config, LocalDate effectiveFrom) {
    }

    public record AssignmentRequest(Long aeId, Long configId, LocalDate effectiveDate, LocalDate endDate) {
    }
}
