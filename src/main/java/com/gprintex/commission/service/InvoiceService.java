package com.gprintex.commission.service;

import com.gprintex.commission.domain.BatchResult;
import com.gprintex.commission.domain.Invoice;
import com.gprintex.commission.domain.InvoiceResult;
import com.gprintex.commission.domain.ValidationResult;
import com.gprintex.commission.exception.CommissionLockedException;
import com.gprintex.commission.exception.ConfigNotFoundException;
import com.gprintex.commission.exception.EntityNotFoundException;
import com.gprintex.commission.exception.ValidationException;
import com.gprintex.commission.repository.CommissionRepository;
import com.gprintex.commission.repository.ContractRepository;
import com.gprintex.commission.repository.InvoiceRepository;
import io.vavr.control.Either;
import io.vavr.control.Try;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Invoice lifecycle. Creating an invoice triggers its commission calculation.
 */
@Service
public class InvoiceService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceService.class);

    private final InvoiceRepository invoices;
    private final ContractRepository contracts;
    private final CommissionRepository commissions;
    private final CommissionEngine engine;

    public InvoiceService(
        InvoiceRepository invoices,
        ContractRepository contracts,
        CommissionRepository commissions,
        CommissionEngine engine
    ) {
        this.invoices = invoices;
        this.contracts = contracts;
        this.commissions = commissions;
        this.engine = engine;
    }

    // ========================================================================
    // CREATE
    // ========================================================================

    /**
     * Store the invoice, then calculate its commission in a separate transaction.
     * A missing commission plan leaves the invoice in place without a commission so it can be backfilled.
     */
    public Either<List<ValidationResult>, InvoiceResult> create(Invoice invoice) {
        var errors = validate(invoice);
        if (!errors.isEmpty()) {
            return Either.left(errors);
        }
        var saved = invoices.insert(invoice);
        log.info("Created invoice {} for contract {} ({} on {})",
            saved.id().orElse(null), saved.contractId(), saved.amount(), saved.invoiceDate());
        return Either.right(calculateFor(saved));
    }

    InvoiceResult calculateFor(Invoice saved) {
        try {
            return InvoiceResult.of(saved, engine.calculateOrGet(saved));
        } catch (ConfigNotFoundException e) {
            log.warn("Invoice {} stored without commission: {}", saved.id().orElse(null), e.getMessage());
            return InvoiceResult.withoutCommission(saved, e.getErrorCode());
        }
    }

    // ========================================================================
    // READ
    // ========================================================================

    @Transactional(readOnly = true)
    public Optional<InvoiceResult> findById(Long id) {
        return invoices.findById(id)
            .map(invoice -> new InvoiceResult(invoice, commissions.findByInvoiceId(id), Optional.empty()));
    }

    @Transactional(readOnly = true)
    public List<Invoice> findByContract(Long contractId) {
        return invoices.findByContract(contractId);
    }

    // ========================================================================
    // UPDATE
    // ========================================================================

    /**
     * Update an invoice and recalculate its pending commission.
     *
     * @throws CommissionLockedException when the invoice's commission is approved or paid
     */
    @Transactional
    public InvoiceResult update(Invoice invoice) {
        var id = invoice.id().orElseThrow(() -> new IllegalArgumentException("Invoice id is required"));
        var existing = invoices.findById(id)
            .orElseThrow(() -> new EntityNotFoundException("Invoice", id));
        var commission = commissions.findByInvoiceId(id);
        commission.filter(c -> c.isLocked()).ifPresent(c -> {
            throw new CommissionLockedException(
                "Invoice " + id + " has a " + c.status().wireValue() + " commission and cannot be modified", c.status());
        });
        var errors = validate(invoice);
        if (commission.isPresent() && !existing.contractId().equals(invoice.contractId())) {
            errors.add(ValidationResult.error("CONTRACT_CHANGE_NOT_ALLOWED",
                "An invoice with a commission cannot move to another contract", "contractId"));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        var updated = invoice.withExternalInvoiceId(invoice.externalInvoiceId().or(existing::externalInvoiceId).orElse(null));
        invoices.update(updated);
        log.info("Updated invoice {}", id);

        if (commission.isPresent() && commission.get().isPending()) {
            return InvoiceResult.of(updated, engine.recalculate(id));
        }
        return new InvoiceResult(updated, commission, Optional.empty());
    }

    // ========================================================================
    // BATCH
    // ========================================================================

    /**
     * Calculate commissions for every invoice that has none. Failures are counted per invoice.
     */
    public Try<BatchResult> backfillMissingCommissions() {
        return Try.of(() -> {
            var result = BatchResult.start("backfill");
            var pending = invoices.findWithoutCommission();
            long created = 0;
            long failed = 0;
            var errors = new ArrayList<String>();
            for (var invoice : pending) {
                var outcome = Try.of(() -> engine.calculateOrGet(invoice));
                if (outcome.isSuccess()) {
                    created++;
                } else {
                    failed++;
                    errors.add("invoice " + invoice.id().orElse(null) + ": " + outcome.getCause().getMessage());
                    log.warn("Backfill failed for invoice {}: {}", invoice.id().orElse(null), outcome.getCause().getMessage());
                }
            }
            log.info("Backfill finished: {} invoices without commission, {} created, {} failed",
                pending.size(), created, failed);
            return result.withCounts(pending.size(), created, 0, failed, errors);
        });
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    List<ValidationResult> validate(Invoice invoice) {
        var errors = new ArrayList<ValidationResult>();
        if (contracts.findById(invoice.contractId()).isEmpty()) {
            errors.add(ValidationResult.error("CONTRACT_NOT_FOUND",
                "Contract " + invoice.contractId() + " does not exist", "contractId"));
        }
        invoice.externalInvoiceId()
            .flatMap(invoices::findByExternalId)
            .filter(other -> !other.id().equals(invoice.id()))
            .ifPresent(other -> errors.add(ValidationResult.error("EXTERNAL_ID_TAKEN",
                "External invoice id is already mapped to invoice " + other.id().orElse(null), "externalInvoiceId")));
        return errors;
    }
}
