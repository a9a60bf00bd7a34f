package com.gprintex.commission.service;

import com.gprintex.commission.domain.CommissionStatus;
import com.gprintex.commission.domain.Contract;
import com.gprintex.commission.domain.ValidationResult;
import com.gprintex.commission.exception.CommissionLockedException;
import com.gprintex.commission.exception.EntityNotFoundException;
import com.gprintex.commission.repository.AccountExecutiveRepository;
import com.gprintex.commission.repository.CommissionRepository;
import com.gprintex.commission.repository.ContractRepository;
import com.gprintex.commission.repository.ContractRepository.ContractFilter;
import com.gprintex.commission.repository.InvoiceRepository;
import io.vavr.control.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Contract service. Contracts become read-only once one of their commissions is approved or paid.
 */
@Service
public class ContractService {

    private static final Logger log = LoggerFactory.getLogger(ContractService.class);

    private final ContractRepository contracts;
    private final InvoiceRepository invoices;
    private final CommissionRepository commissions;
    private final AccountExecutiveRepository accountExecutives;
    private final CommissionEngine engine;

    public ContractService(
        ContractRepository contracts,
        InvoiceRepository invoices,
        CommissionRepository commissions,
        AccountExecutiveRepository accountExecutives,
        CommissionEngine engine
    ) {
        this.contracts = contracts;
        this.invoices = invoices;
        this.commissions = commissions;
        this.accountExecutives = accountExecutives;
        this.engine = engine;
    }

    // ========================================================================
    // CREATE
    // ========================================================================

    @Transactional
    public Either<List<ValidationResult>, Contract> create(Contract contract) {
        var errors = validate(contract);
        if (!errors.isEmpty()) {
            return Either.left(errors);
        }
        var saved = contracts.insert(contract);
        log.info("Created contract {} for client '{}' (AE {})", saved.id().orElse(null), saved.clientName(), saved.aeId());
        return Either.right(saved);
    }

    // ========================================================================
    // READ
    // ========================================================================

    @Transactional(readOnly = true)
    public Optional<Contract> findById(Long id) {
        return contracts.findById(id);
    }

    @Transactional(readOnly = true)
    public List<Contract> findByFilter(ContractFilter filter) {
        return contracts.findByFilter(filter);
    }

    // ========================================================================
    // UPDATE
    // ========================================================================

    /**
     * Update contract terms and recalculate the pending commissions of its invoices.
     *
     * @throws CommissionLockedException when any commission of the contract is approved or paid
     */
    @Transactional
    public Either<List<ValidationResult>, Contract> update(Contract contract) {
        var id = contract.id().orElseThrow(() -> new IllegalArgumentException("Contract id is required"));
        var existing = contracts.findById(id)
            .orElseThrow(() -> new EntityNotFoundException("Contract", id));
        if (commissions.existsLockedForContract(id)) {
            throw new CommissionLockedException(
                "Contract " + id + " has approved or paid commissions and cannot be modified", CommissionStatus.APPROVED);
        }
        var errors = validate(contract);
        if (!existing.aeId().equals(contract.aeId()) && hasCommissions(id)) {
            errors.add(ValidationResult.error("AE_CHANGE_NOT_ALLOWED",
                "The AE of a contract with commissions cannot change", "aeId"));
        }
        if (!errors.isEmpty()) {
            return Either.left(errors);
        }

        contracts.update(contract);
        var recalculated = invoices.findByContract(id).stream()
            .filter(invoice -> commissions.findByInvoiceId(invoice.id().orElseThrow())
                .filter(c -> c.isPending())
                .isPresent())
            .map(invoice -> engine.recalculate(invoice.id().orElseThrow()))
            .toList();
        log.info("Updated contract {}, recalculated {} pending commissions", id, recalculated.size());
        return Either.right(contract);
    }

    private boolean hasCommissions(Long contractId) {
        return invoices.findByContract(contractId).stream()
            .anyMatch(invoice -> commissions.findByInvoiceId(invoice.id().orElseThrow()).isPresent());
    }

    List<ValidationResult> validate(Contract contract) {
        var errors = new ArrayList<ValidationResult>();
        if (!accountExecutives.exists(contract.aeId())) {
            errors.add(ValidationResult.error("AE_NOT_FOUND", "Account executive " + contract.aeId() + " does not exist", "aeId"));
        }
        if (contract.acv().compareTo(contract.totalValue()) > 0) {
            errors.add(ValidationResult.error("ACV_EXCEEDS_TOTAL", "ACV cannot exceed the total contract value", "acv"));
        }
        return errors;
    }
}
