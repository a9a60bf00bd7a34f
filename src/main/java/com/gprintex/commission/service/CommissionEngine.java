package com.gprintex.commission.service;

import com.gprintex.commission.domain.BonusBreakdown;
import com.gprintex.commission.domain.CapResult;
import com.gprintex.commission.domain.Commission;
import com.gprintex.commission.domain.CommissionApprovedEvent;
import com.gprintex.commission.domain.CommissionConfig;
import com.gprintex.commission.domain.CommissionStatus;
import com.gprintex.commission.domain.Contract;
import com.gprintex.commission.domain.Invoice;
import com.gprintex.commission.domain.Money;
import com.gprintex.commission.exception.CommissionLockedException;
import com.gprintex.commission.exception.DuplicateCommissionException;
import com.gprintex.commission.exception.EntityNotFoundException;
import com.gprintex.commission.exception.InvalidTransitionException;
import com.gprintex.commission.exception.ValidationException;
import com.gprintex.commission.repository.CommissionConfigRepository;
import com.gprintex.commission.repository.CommissionRepository;
import com.gprintex.commission.repository.ContractRepository;
import com.gprintex.commission.repository.InvoiceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Commission calculation engine.
 * <p>
 * Turns an invoice into exactly one priced commission and owns the
 * pending → approved → paid / pending → rejected workflow.
 */
@Service
public class CommissionEngine {

    private static final Logger log = LoggerFactory.getLogger(CommissionEngine.class);

    private final ContractRepository contracts;
    private final InvoiceRepository invoices;
    private final CommissionRepository commissions;
    private final CommissionConfigRepository configs;
    private final ConfigResolver configResolver;
    private final BonusCalculator bonusCalculator;
    private final OteCapTracker capTracker;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public CommissionEngine(
        ContractRepository contracts,
        InvoiceRepository invoices,
        CommissionRepository commissions,
        CommissionConfigRepository configs,
        ConfigResolver configResolver,
        BonusCalculator bonusCalculator,
        OteCapTracker capTracker,
        ApplicationEventPublisher events,
        Clock clock
    ) {
        this.contracts = contracts;
        this.invoices = invoices;
        this.commissions = commissions;
        this.configs = configs;
        this.configResolver = configResolver;
        this.bonusCalculator = bonusCalculator;
        this.capTracker = capTracker;
        this.events = events;
        this.clock = clock;
    }

    // ========================================================================
    // CALCULATION
    // ========================================================================

    /**
     * Calculate and persist the commission of an invoice with status pending.
     *
     * @throws DuplicateCommissionException when the invoice already has a commission (carries the existing one)
     * @throws com.gprintex.commission.exception.ConfigNotFoundException when no plan can be resolved
     */
    @Transactional
    public Commission calculateCommission(Invoice invoice) {
        var invoiceId = invoice.id()
            .orElseThrow(() -> new IllegalArgumentException("Invoice must be persisted before calculating commission"));

        var existing = commissions.findByInvoiceId(invoiceId);
        if (existing.isPresent()) {
            throw new DuplicateCommissionException(invoiceId, existing.get());
        }

        var contract = requireContract(invoice.contractId());
        var resolution = configResolver.resolve(contract.aeId(), invoice.invoiceDate());
        var commission = price(contract, invoice, resolution.config());

        try {
            var saved = commissions.insert(commission);
            log.info("Created commission {} for invoice {} (AE {}): base {} + bonuses {} = {}{}",
                saved.id().orElse(null), invoiceId, saved.aeId(), saved.baseCommission(),
                saved.bonuses().total(), saved.totalCommission(), saved.oteApplied() ? " [OTE applied]" : "");
            return saved;
        } catch (DuplicateKeyException e) {
            log.info("Lost commission race for invoice {}, returning existing record", invoiceId);
            throw new DuplicateCommissionException(invoiceId, commissions.findByInvoiceId(invoiceId).orElse(null));
        }
    }

    /**
     * Idempotent variant of {@link #calculateCommission}: returns the existing commission on a duplicate.
     */
    @Transactional
    public Commission calculateOrGet(Invoice invoice) {
        try {
            return calculateCommission(invoice);
        } catch (DuplicateCommissionException e) {
            return e.getExisting()
                .or(() -> commissions.findByInvoiceId(e.getInvoiceId()))
                .orElseThrow(() -> e);
        }
    }

    /**
     * Recompute the figures of a pending commission from the current contract, invoice and plan.
     * Creates the commission when the invoice has none yet.
     *
     * @throws CommissionLockedException when the commission is no longer pending
     */
    @Transactional
    public Commission recalculate(Long invoiceId) {
        var invoice = invoices.findById(invoiceId)
            .orElseThrow(() -> new EntityNotFoundException("Invoice", invoiceId));
        var current = commissions.findByInvoiceId(invoiceId);
        if (current.isEmpty()) {
            return calculateCommission(invoice);
        }

        var commission = current.get();
        if (!commission.isPending()) {
            throw new CommissionLockedException(
                "Commission for invoice " + invoiceId + " is " + commission.status().wireValue()
                    + " and can no longer be recalculated", commission.status());
        }

        var contract = requireContract(invoice.contractId());
        var config = configResolver.resolve(contract.aeId(), invoice.invoiceDate()).config();
        var recalculated = reprice(commission, contract, invoice, config);

        if (!commissions.updateFigures(recalculated)) {
            var latest = commissions.findByInvoiceId(invoiceId).orElse(commission);
            throw new CommissionLockedException(
                "Commission for invoice " + invoiceId + " changed status during recalculation", latest.status());
        }
        log.info("Recalculated commission {} for invoice {}: total {} -> {}",
            commission.id().orElse(null), invoiceId, commission.totalCommission(), recalculated.totalCommission());
        return recalculated;
    }

    private Commission price(Contract contract, Invoice invoice, CommissionConfig config) {
        var invoiceId = invoice.id().orElseThrow();
        var configId = config.id().orElse(null);
        if (!invoice.revenueType().isCommissionable()) {
            log.info("Invoice {} is {} revenue, recording zero commission", invoiceId, invoice.revenueType().wireValue());
            return Commission.zero(invoiceId, contract.aeId(), configId, now());
        }
        var grossBase = bonusCalculator.grossBaseCommission(contract, invoice, config);
        var cap = capTracker.applyCap(contract.aeId(), invoice.capYear(), grossBase, config);
        var bonuses = bonusCalculator.computeBonuses(contract, invoice, config);
        return Commission.pending(invoiceId, contract.aeId(), configId, grossBase, cap, bonuses, now());
    }

    private Commission reprice(Commission current, Contract contract, Invoice invoice, CommissionConfig config) {
        var configId = config.id().orElse(null);
        if (!invoice.revenueType().isCommissionable()) {
            return current.withFigures(configId, Money.ZERO, CapResult.uncapped(Money.ZERO), BonusBreakdown.none(), now());
        }
        var grossBase = bonusCalculator.grossBaseCommission(contract, invoice, config);
        var cap = capTracker.reapplyCap(contract.aeId(), invoice.capYear(), grossBase, config, current);
        var bonuses = bonusCalculator.computeBonuses(contract, invoice, config);
        return current.withFigures(configId, grossBase, cap, bonuses, now());
    }

    // ========================================================================
    // STATE MACHINE
    // ========================================================================

    /**
     * Dispatch a requested status change.
     */
    @Transactional
    public Commission transition(Long commissionId, CommissionStatus target, String user, String reason) {
        if (target == null) {
            throw new ValidationException("STATUS_REQUIRED", "Target status is required", "status");
        }
        return switch (target) {
            case APPROVED -> approve(commissionId, user);
            case REJECTED -> reject(commissionId, reason, user);
            case PAID -> markPaid(commissionId, user);
            case PENDING -> {
                var current = requireCommission(commissionId);
                throw new InvalidTransitionException(commissionId, current.status(), CommissionStatus.PENDING);
            }
        };
    }

    /**
     * pending → approved. Under the realized-only cap policy the base amount is settled against the
     * realized total of the AE's year while holding the ledger lock.
     */
    @Transactional
    public Commission approve(Long commissionId, String user) {
        var commission = requireCommission(commissionId);
        commission.status().requireTransitionTo(CommissionStatus.APPROVED, commissionId);

        if (capTracker.countingPolicy().settlesOnApproval()) {
            commission = settle(commission);
        }

        var approved = commission.approved(user, now());
        compareAndSet(approved, CommissionStatus.PENDING);
        log.info("Commission {} approved by {} (total {})", commissionId, user, approved.totalCommission());
        events.publishEvent(CommissionApprovedEvent.of(approved));
        return approved;
    }

    /**
     * pending → rejected. A rejection reason is mandatory.
     */
    @Transactional
    public Commission reject(Long commissionId, String reason, String user) {
        var commission = requireCommission(commissionId);
        commission.status().requireTransitionTo(CommissionStatus.REJECTED, commissionId);
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("REJECTION_REASON_REQUIRED",
                "A rejection reason is required to reject a commission", "rejectionReason");
        }
        var rejected = commission.rejected(reason.trim(), now());
        compareAndSet(rejected, CommissionStatus.PENDING);
        log.info("Commission {} rejected by {}: {}", commissionId, user, reason);
        return rejected;
    }

    /**
     * approved → paid.
     */
    @Transactional
    public Commission markPaid(Long commissionId, String user) {
        var commission = requireCommission(commissionId);
        var paid = commission.paid(user, now());
        compareAndSet(paid, CommissionStatus.APPROVED);
        log.info("Commission {} marked paid by {}", commissionId, user);
        return paid;
    }

    private Commission settle(Commission commission) {
        var invoice = invoices.findById(commission.invoiceId())
            .orElseThrow(() -> new EntityNotFoundException("Invoice", commission.invoiceId()));
        var config = commission.configId()
            .flatMap(configs::findById)
            .or(configResolver::defaultConfig)
            .orElse(null);
        if (config == null || !invoice.revenueType().isCommissionable()) {
            return commission;
        }
        var cap = capTracker.settleOnApproval(commission.aeId(), invoice.capYear(), commission.grossBaseCommission(), config);
        if (cap.cappedAmount().compareTo(commission.baseCommission()) == 0 && cap.oteApplied() == commission.oteApplied()) {
            return commission;
        }
        var settled = commission.withSettledBase(cap, now());
        if (!commissions.updateFigures(settled)) {
            var latest = requireCommission(commission.id().orElseThrow());
            throw new InvalidTransitionException(latest.id().orElse(null), latest.status(), CommissionStatus.APPROVED);
        }
        log.info("Commission {} base settled at approval: {} -> {} (OTE applied: {})",
            commission.id().orElse(null), commission.baseCommission(), settled.baseCommission(), settled.oteApplied());
        return settled;
    }

    private void compareAndSet(Commission updated, CommissionStatus expected) {
        if (!commissions.updateStatus(updated, expected)) {
            var latest = requireCommission(updated.id().orElseThrow());
            throw new InvalidTransitionException(latest.id().orElse(null), latest.status(), updated.status());
        }
    }

    private Commission requireCommission(Long commissionId) {
        return commissions.findById(commissionId)
            .orElseThrow(() -> new EntityNotFoundException("Commission", commissionId));
    }

    private Contract requireContract(Long contractId) {
        return contracts.findById(contractId)
            .orElseThrow(() -> new EntityNotFoundException("Contract", contractId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
