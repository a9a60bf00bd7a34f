package com.gprintex.commission.api;

import com.gprintex.commission.domain.Commission;
import com.gprintex.commission.domain.CommissionDetails;
import com.gprintex.commission.domain.CommissionStatus;
import com.gprintex.commission.repository.CommissionRepository.CommissionFilter;
import com.gprintex.commission.service.CommissionEngine;
import com.gprintex.commission.service.CommissionQueryService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * REST API controller for commissions and their approval workflow.
 */
@RestController
@RequestMapping("/api/v1/commissions")
public class CommissionController {

    private final CommissionQueryService queryService;
    private final CommissionEngine engine;

    public CommissionController(CommissionQueryService queryService, CommissionEngine engine) {
        this.queryService = queryService;
        this.engine = engine;
    }

    @GetMapping
    public List<CommissionDetails> list(
        @RequestParam(required = false) Long aeId,
        @RequestParam(required = false) String status,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        var filter = CommissionFilter.all()
            .withStatus(status != null ? CommissionStatus.fromWire(status) : null)
            .withDateRange(from, to);
        if (aeId != null) filter = filter.withAe(aeId);
        return queryService.find(filter);
    }

    @GetMapping("/pending")
    public List<CommissionDetails> pendingApprovals() {
        return queryService.pendingApprovals();
    }

    @GetMapping("/{id}")
    public ResponseEntity<Commission> getById(@PathVariable Long id) {
        return queryService.findById(id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/by-invoice/{invoiceId}")
    public ResponseEntity<Commission> getByInvoice(@PathVariable Long invoiceId) {
        return queryService.findByInvoice(invoiceId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @PatchMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public Commission updateStatus(
        @PathVariable Long id,
        @RequestBody StatusChangeRequest request,
        @RequestHeader(value = RequestUser.HEADER, required = false) String userId,
        Principal principal
    ) {
        var target = Optional.ofNullable(request.status()).map(CommissionStatus::fromWire).orElse(null);
        return engine.transition(id, target, RequestUser.resolve(userId, principal), request.rejectionReason());
    }

    public record StatusChangeRequest(String status, String rejectionReason) {
    }
}
