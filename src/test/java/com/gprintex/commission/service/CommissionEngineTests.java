package com.gprintex.commission.service;

import com.gprintex.commission.config.CommissionProperties;
import com.gprintex.commission.domain.BonusBreakdown;
import com.gprintex.commission.domain.CapCountingPolicy;
import com.gprintex.commission.domain.CapResult;
import com.gprintex.commission.domain.Commission;
import com.gprintex.commission.domain.CommissionApprovedEvent;
import com.gprintex.commission.domain.CommissionConfig;
import com.gprintex.commission.domain.CommissionStatus;
import com.gprintex.commission.domain.ConfigResolution;
import com.gprintex.commission.domain.Contract;
import com.gprintex.commission.domain.Invoice;
import com.gprintex.commission.domain.MultiYearBonusPolicy;
import com.gprintex.commission.domain.PaymentTerms;
import com.gprintex.commission.domain.RevenueType;
import com.gprintex.commission.exception.CommissionLockedException;
import com.gprintex.commission.exception.DuplicateCommissionException;
import com.gprintex.commission.exception.InvalidTransitionException;
import com.gprintex.commission.exception.ValidationException;
import com.gprintex.commission.repository.CapLedgerRepository;
import com.gprintex.commission.repository.CommissionConfigRepository;
import com.gprintex.commission.repository.CommissionRepository;
import com.gprintex.commission.repository.ContractRepository;
import com.gprintex.commission.repository.InvoiceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommissionEngineTests {

    private static final Long AE = 7L;
    private static final LocalDate INVOICE_DATE = LocalDate.of(2025, 5, 10);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T09:00:00Z"), ZoneOffset.UTC);

    @Mock private ContractRepository contracts;
    @Mock private InvoiceRepository invoices;
    @Mock private CommissionRepository commissions;
    @Mock private CommissionConfigRepository configs;
    @Mock private CapLedgerRepository ledger;
    @Mock private ConfigResolver configResolver;
    @Mock private ApplicationEventPublisher events;

    private CommissionEngine engine;

    private final CommissionConfig plan = CommissionConfig.draft("Plan", new BigDecimal("0.10"))
        .withBonusRates(new BigDecimal("0.05"), new BigDecimal("0.02"), new BigDecimal("0.03"))
        .withId(10L);
    private final Contract contract = Contract.of("Acme", AE, new BigDecimal("300000")).withId(3L);
    private final Invoice invoice = Invoice.of(3L, new BigDecimal("100000"), INVOICE_DATE).withId(42L);

    @BeforeEach
    void setUp() {
        engine = engine(CapCountingPolicy.REALIZED_ONLY);
    }

    private CommissionEngine engine(CapCountingPolicy policy) {
        var properties = new CommissionProperties(null, new CommissionProperties.OteProperties(policy), null, null, null);
        return new CommissionEngine(contracts, invoices, commissions, configs, configResolver,
            new BonusCalculator(MultiYearBonusPolicy.FLAT), new OteCapTracker(commissions, ledger, properties),
            events, CLOCK);
    }

    // ========================================================================
    // CALCULATION
    // ========================================================================

    @Test
    void calculateCommission_shouldPriceBaseAndBonuses() {
        var multiYearUpfront = contract.withTerms(3, PaymentTerms.FULL_UPFRONT).withPilot(true);
        when(commissions.findByInvoiceId(42L)).thenReturn(Optional.empty());
        when(contracts.findById(3L)).thenReturn(Optional.of(multiYearUpfront));
        when(configResolver.resolve(AE, INVOICE_DATE)).thenReturn(ConfigResolution.assigned(plan, 1L));
        when(commissions.insert(any())).thenAnswer(inv -> inv.<Commission>getArgument(0).withId(500L));

        var commission = engine.calculateCommission(invoice);

        assertEquals(Optional.of(500L), commission.id());
        assertEquals(new BigDecimal("10000.00"), commission.baseCommission());
        assertEquals(new BigDecimal("5000.00"), commission.pilotBonus());
        assertEquals(new BigDecimal("2000.00"), commission.multiYearBonus());
        assertEquals(new BigDecimal("3000.00"), commission.upfrontBonus());
        assertEquals(new BigDecimal("20000.00"), commission.totalCommission());
        assertEquals(Optional.of(10L), commission.configId());
        assertEquals(CommissionStatus.PENDING, commission.status());
        assertFalse(commission.oteApplied());
        assertEquals(Optional.of(LocalDateTime.now(CLOCK)), commission.createdAt());
        verifyNoInteractions(ledger);
    }

    @Test
    void calculateCommission_cappedPlanDeceleratesBaseButNotBonuses() {
        var capped = plan.withCap(new BigDecimal("100000"), new BigDecimal("0.5"));
        var pilotContract = contract.withPilot(true);
        var bigInvoice = Invoice.of(3L, new BigDecimal("10000000"), INVOICE_DATE).withId(42L);
        when(commissions.findByInvoiceId(42L)).thenReturn(Optional.empty());
        when(contracts.findById(3L)).thenReturn(Optional.of(pilotContract));
        when(configResolver.resolve(AE, INVOICE_DATE)).thenReturn(ConfigResolution.assigned(capped, 1L));
        when(commissions.sumBaseCommission(eq(AE), eq(2025), any())).thenReturn(new BigDecimal("95000"));
        when(commissions.insert(any())).thenAnswer(inv -> inv.<Commission>getArgument(0).withId(500L));

        var commission = engine.calculateCommission(bigInvoice);

        assertEquals(new BigDecimal("1000000.00"), commission.grossBaseCommission());
        assertEquals(new BigDecimal("502500.00"), commission.baseCommission());
        assertEquals(new BigDecimal("500000.00"), commission.pilotBonus());
        assertTrue(commission.oteApplied());
        verify(ledger).lock(AE, 2025);
    }

    @Test
    void calculateCommission_nonRecurringRevenueGetsZeroCommission() {
        var service = invoice.withRevenueType(RevenueType.SERVICE);
        when(commissions.findByInvoiceId(42L)).thenReturn(Optional.empty());
        when(contracts.findById(3L)).thenReturn(Optional.of(contract.withPilot(true)));
        when(configResolver.resolve(AE, INVOICE_DATE)).thenReturn(ConfigResolution.assigned(plan, 1L));
        when(commissions.insert(any())).thenAnswer(inv -> inv.<Commission>getArgument(0).withId(501L));

        var commission = engine.calculateCommission(service);

        assertEquals(new BigDecimal("0.00"), commission.totalCommission());
        assertEquals(CommissionStatus.PENDING, commission.status());
    }

    @Test
    void calculateCommission_existingCommissionIsDuplicate() {
        var existing = pendingCommission(500L);
        when(commissions.findByInvoiceId(42L)).thenReturn(Optional.of(existing));

        var ex = assertThrows(DuplicateCommissionException.class, () -> engine.calculateCommission(invoice));

        assertEquals(Optional.of(existing), ex.getExisting());
        verify(commissions, never()).insert(any());
    }

    @Test
    void calculateCommission_lostInsertRaceReturnsWinner() {
        var winner = pendingCommission(600L);
        when(commissions.findByInvoiceId(42L)).thenReturn(Optional.empty(), Optional.of(winner));
        when(contracts.findById(3L)).thenReturn(Optional.of(contract));
        when(configResolver.resolve(AE, INVOICE_DATE)).thenReturn(ConfigResolution.fallback(CommissionConfig.systemDefault(new BigDecimal("0.10"))));
        when(commissions.insert(any())).thenThrow(new DuplicateKeyException("uq_commission_invoice"));

        var ex = assertThrows(DuplicateCommissionException.class, () -> engine.calculateCommission(invoice));
        assertEquals(Optional.of(winner), ex.getExisting());
    }

    @Test
    void calculateOrGet_returnsExistingOnDuplicate() {
        var existing = pendingCommission(500L);
        when(commissions.findByInvoiceId(42L)).thenReturn(Optional.of(existing));

        assertEquals(existing, engine.calculateOrGet(invoice));
    }

    @Test
    void calculateCommission_defaultPlanHasNoConfigId() {
        when(commissions.findByInvoiceId(42L)).thenReturn(Optional.empty());
        when(contracts.findById(3L)).thenReturn(Optional.of(contract));
        when(configResolver.resolve(AE, INVOICE_DATE))
            .thenReturn(ConfigResolution.fallback(CommissionConfig.systemDefault(new BigDecimal("0.10"))));
        when(commissions.insert(any())).thenAnswer(inv -> inv.<Commission>getArgument(0).withId(502L));

        var commission = engine.calculateCommission(invoice);

        assertTrue(commission.configId().isEmpty());
        assertEquals(new BigDecimal("10000.00"), commission.totalCommission());
    }

    @Test
    void recalculate_lockedCommissionFails() {
        var approved = pendingCommission(500L).approved("boss", LocalDateTime.now(CLOCK));
        when(invoices.findById(42L)).thenReturn(Optional.of(invoice));
        when(commissions.findByInvoiceId(42L)).thenReturn(Optional.of(approved));

        assertThrows(CommissionLockedException.class, () -> engine.recalculate(42L));
        verify(commissions, never()).updateFigures(any());
    }

    @Test
    void recalculate_pendingCommissionIsRepriced() {
        var current = pendingCommission(500L);
        var raised = Invoice.of(3L, new BigDecimal("150000"), INVOICE_DATE).withId(42L);
        when(invoices.findById(42L)).thenReturn(Optional.of(raised));
        when(commissions.findByInvoiceId(42L)).thenReturn(Optional.of(current));
        when(contracts.findById(3L)).thenReturn(Optional.of(contract));
        when(configResolver.resolve(AE, INVOICE_DATE)).thenReturn(ConfigResolution.assigned(plan, 1L));
        when(commissions.updateFigures(any())).thenReturn(true);

        var recalculated = engine.recalculate(42L);

        assertEquals(new BigDecimal("15000.00"), recalculated.totalCommission());
        assertEquals(Optional.of(500L), recalculated.id());
        assertEquals(Optional.of(LocalDateTime.now(CLOCK)), recalculated.updatedAt());
    }

    // ========================================================================
    // STATE MACHINE
    // ========================================================================

    @Test
    void approve_shouldStampUserAndPublishEvent() {
        var pending = pendingCommission(500L);
        when(commissions.findById(500L)).thenReturn(Optional.of(pending));
        when(invoices.findById(42L)).thenReturn(Optional.of(invoice));
        when(configs.findById(10L)).thenReturn(Optional.of(plan));
        when(commissions.updateStatus(any(), eq(CommissionStatus.PENDING))).thenReturn(true);

        var approved = engine.approve(500L, "manager");

        assertEquals(CommissionStatus.APPROVED, approved.status());
        assertEquals(Optional.of("manager"), approved.approvedBy());
        assertEquals(Optional.of(LocalDateTime.now(CLOCK)), approved.approvedAt());
        var event = ArgumentCaptor.forClass(CommissionApprovedEvent.class);
        verify(events).publishEvent(event.capture());
        assertEquals(500L, event.getValue().commissionId());
        assertEquals(new BigDecimal("10000.00"), event.getValue().totalCommission());
        verify(commissions, never()).updateFigures(any());
    }

    @Test
    void approve_settlesBaseAgainstRealizedTotal() {
        var capped = plan.withCap(new BigDecimal("100000"), new BigDecimal("0.5"));
        var pending = pendingCommission(500L);
        when(commissions.findById(500L)).thenReturn(Optional.of(pending));
        when(invoices.findById(42L)).thenReturn(Optional.of(invoice));
        when(configs.findById(10L)).thenReturn(Optional.of(capped));
        when(commissions.sumApprovedBaseCommission(AE, 2025)).thenReturn(new BigDecimal("100000"));
        when(commissions.updateFigures(any())).thenReturn(true);
        when(commissions.updateStatus(any(), eq(CommissionStatus.PENDING))).thenReturn(true);

        var approved = engine.approve(500L, "manager");

        assertEquals(new BigDecimal("5000.00"), approved.baseCommission());
        assertEquals(new BigDecimal("5000.00"), approved.totalCommission());
        assertTrue(approved.oteApplied());
        verify(ledger).lock(AE, 2025);
    }

    @Test
    void approve_includePendingPolicyDoesNotSettle() {
        engine = engine(CapCountingPolicy.INCLUDE_PENDING);
        when(commissions.findById(500L)).thenReturn(Optional.of(pendingCommission(500L)));
        when(commissions.updateStatus(any(), eq(CommissionStatus.PENDING))).thenReturn(true);

        engine.approve(500L, "manager");

        verifyNoInteractions(ledger, invoices, configs);
    }

    @Test
    void approve_alreadyApprovedIsInvalidTransition() {
        var approved = pendingCommission(500L).approved("first", LocalDateTime.now(CLOCK));
        when(commissions.findById(500L)).thenReturn(Optional.of(approved));

        var ex = assertThrows(InvalidTransitionException.class, () -> engine.approve(500L, "second"));

        assertEquals(CommissionStatus.APPROVED, ex.getFrom());
        verify(commissions, never()).updateStatus(any(), any());
        verifyNoInteractions(events);
    }

    @Test
    void approve_concurrentStatusChangeIsInvalidTransition() {
        var pending = pendingCommission(500L);
        var rejected = pending.rejected("too late", LocalDateTime.now(CLOCK));
        when(commissions.findById(500L)).thenReturn(Optional.of(pending), Optional.of(rejected));
        when(invoices.findById(42L)).thenReturn(Optional.of(invoice));
        when(configs.findById(10L)).thenReturn(Optional.of(plan));
        when(commissions.updateStatus(any(), eq(CommissionStatus.PENDING))).thenReturn(false);

        var ex = assertThrows(InvalidTransitionException.class, () -> engine.approve(500L, "manager"));

        assertEquals(CommissionStatus.REJECTED, ex.getFrom());
        verifyNoInteractions(events);
    }

    @Test
    void reject_requiresReason() {
        when(commissions.findById(500L)).thenReturn(Optional.of(pendingCommission(500L)));

        var ex = assertThrows(ValidationException.class, () -> engine.reject(500L, " ", "manager"));

        assertEquals("REJECTION_REASON_REQUIRED", ex.getErrors().get(0).errorCode());
        verify(commissions, never()).updateStatus(any(), any());
    }

    @Test
    void reject_storesReason() {
        when(commissions.findById(500L)).thenReturn(Optional.of(pendingCommission(500L)));
        when(commissions.updateStatus(any(), eq(CommissionStatus.PENDING))).thenReturn(true);

        var rejected = engine.reject(500L, "Duplicate deal", "manager");

        assertEquals(CommissionStatus.REJECTED, rejected.status());
        assertEquals(Optional.of("Duplicate deal"), rejected.rejectionReason());
    }

    @Test
    void markPaid_fromPendingIsInvalidTransition() {
        when(commissions.findById(500L)).thenReturn(Optional.of(pendingCommission(500L)));

        assertThrows(InvalidTransitionException.class, () -> engine.markPaid(500L, "finance"));
    }

    @Test
    void transition_toPendingIsNeverAllowed() {
        when(commissions.findById(500L)).thenReturn(Optional.of(pendingCommission(500L)));

        assertThrows(InvalidTransitionException.class,
            () -> engine.transition(500L, CommissionStatus.PENDING, "manager", null));
        assertThrows(ValidationException.class, () -> engine.transition(500L, null, "manager", null));
    }

    private Commission pendingCommission(Long id) {
        return Commission.pending(42L, AE, 10L, new BigDecimal("10000.00"),
            CapResult.uncapped(new BigDecimal("10000.00")), BonusBreakdown.none(), LocalDateTime.now(CLOCK)).withId(id);
    }
}
