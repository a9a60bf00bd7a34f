package com.gprintex.commission.api;

import com.gprintex.commission.domain.AccountExecutive;
import com.gprintex.commission.domain.CommissionDetails;
import com.gprintex.commission.domain.CommissionStatus;
import com.gprintex.commission.domain.OteProgress;
import com.gprintex.commission.service.AccountExecutiveService;
import com.gprintex.commission.service.CommissionQueryService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.Year;
import java.util.List;
import java.util.Optional;

/**
 * REST API controller for account executives, their statements and OTE progress.
 */
@RestController
@RequestMapping("/api/v1/account-executives")
public class AccountExecutiveController {

    private final AccountExecutiveService accountExecutiveService;
    private final CommissionQueryService queryService;

    public AccountExecutiveController(AccountExecutiveService accountExecutiveService, CommissionQueryService queryService) {
        this.accountExecutiveService = accountExecutiveService;
        this.queryService = queryService;
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody AccountExecutiveRequest request) {
        var ae = new AccountExecutive(Optional.empty(), request.name(), request.email(),
            request.active() == null || request.active());
        return accountExecutiveService.create(ae).fold(
            errors -> ResponseEntity.badRequest().body(errors),
            created -> ResponseEntity.status(HttpStatus.CREATED).body(created)
        );
    }

    @GetMapping
    public List<AccountExecutive> list() {
        return accountExecutiveService.findAll();
    }

    @GetMapping("/{id}")
    public ResponseEntity<AccountExecutive> getById(@PathVariable Long id) {
        return accountExecutiveService.findById(id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/commissions")
    public List<CommissionDetails> statement(
        @PathVariable Long id,
        @RequestParam(required = false) String status,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return queryService.statement(id, Optional.ofNullable(status).map(CommissionStatus::fromWire),
            Optional.ofNullable(from), Optional.ofNullable(to));
    }

    @GetMapping("/{id}/ote-progress")
    public OteProgress oteProgress(@PathVariable Long id, @RequestParam(required = false) Integer year) {
        return queryService.oteProgress(id, year != null ? year : Year.now().getValue());
    }

    public record AccountExecutiveRequest(String name, String email, Boolean active) {
    }
}
