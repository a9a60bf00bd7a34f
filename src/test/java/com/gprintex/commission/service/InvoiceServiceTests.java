package com.gprintex.commission.service;

import com.gprintex.commission.domain.BonusBreakdown;
import com.gprintex.commission.domain.CapResult;
import com.gprintex.commission.domain.Commission;
import com.gprintex.commission.domain.CommissionStatus;
import com.gprintex.commission.domain.Contract;
import com.gprintex.commission.domain.Invoice;
import com.gprintex.commission.exception.CommissionLockedException;
import com.gprintex.commission.exception.ConfigNotFoundException;
import com.gprintex.commission.exception.ValidationException;
import com.gprintex.commission.repository.CommissionRepository;
import com.gprintex.commission.repository.ContractRepository;
import com.gprintex.commission.repository.InvoiceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InvoiceServiceTests {

    private static final LocalDate MARCH = LocalDate.of(2025, 3, 10);

    @Mock private InvoiceRepository invoices;
    @Mock private ContractRepository contracts;
    @Mock private CommissionRepository commissions;
    @Mock private CommissionEngine engine;

    private InvoiceService service;

    private final Contract contract = Contract.of("Initech", 1L, new BigDecimal("50000")).withId(4L);

    @BeforeEach
    void setUp() {
        service = new InvoiceService(invoices, contracts, commissions, engine);
    }

    @Test
    void create_rejectsUnknownContract() {
        when(contracts.findById(4L)).thenReturn(Optional.empty());

        var result = service.create(Invoice.of(4L, new BigDecimal("1000"), MARCH));

        assertTrue(result.isLeft());
        assertEquals("CONTRACT_NOT_FOUND", result.getLeft().get(0).errorCode());
        verify(invoices, never()).insert(any());
    }

    @Test
    void create_rejectsExternalIdMappedToAnotherInvoice() {
        when(contracts.findById(4L)).thenReturn(Optional.of(contract));
        when(invoices.findByExternalId("inv_7"))
            .thenReturn(Optional.of(Invoice.of(4L, BigDecimal.ONE, MARCH).withId(70L)));

        var result = service.create(Invoice.of(4L, new BigDecimal("1000"), MARCH).withExternalInvoiceId("inv_7"));

        assertTrue(result.isLeft());
        assertEquals("EXTERNAL_ID_TAKEN", result.getLeft().get(0).errorCode());
    }

    @Test
    void create_calculatesCommission() {
        var saved = Invoice.of(4L, new BigDecimal("1000"), MARCH).withId(11L);
        when(contracts.findById(4L)).thenReturn(Optional.of(contract));
        when(invoices.insert(any())).thenReturn(saved);
        when(engine.calculateOrGet(saved)).thenReturn(commission(11L, CommissionStatus.PENDING));

        var result = service.create(Invoice.of(4L, new BigDecimal("1000"), MARCH)).get();

        assertEquals(Optional.of(11L), result.invoice().id());
        assertTrue(result.commission().isPresent());
        assertTrue(result.commissionError().isEmpty());
    }

    @Test
    void create_keepsInvoiceWhenNoConfigResolves() {
        var saved = Invoice.of(4L, new BigDecimal("1000"), MARCH).withId(11L);
        when(contracts.findById(4L)).thenReturn(Optional.of(contract));
        when(invoices.insert(any())).thenReturn(saved);
        when(engine.calculateOrGet(saved)).thenThrow(new ConfigNotFoundException(1L, MARCH));

        var result = service.create(Invoice.of(4L, new BigDecimal("1000"), MARCH)).get();

        assertTrue(result.commission().isEmpty());
        assertEquals(Optional.of("CONFIG_NOT_FOUND"), result.commissionError());
    }

    @Test
    void update_recalculatesPendingCommission() {
        var existing = Invoice.of(4L, new BigDecimal("1000"), MARCH).withId(11L);
        when(invoices.findById(11L)).thenReturn(Optional.of(existing));
        when(commissions.findByInvoiceId(11L)).thenReturn(Optional.of(commission(11L, CommissionStatus.PENDING)));
        when(contracts.findById(4L)).thenReturn(Optional.of(contract));
        when(engine.recalculate(11L)).thenReturn(commission(11L, CommissionStatus.PENDING));

        service.update(Invoice.of(4L, new BigDecimal("2000"), MARCH).withId(11L));

        verify(invoices).update(any());
        verify(engine).recalculate(11L);
    }

    @Test
    void update_refusedOnceCommissionIsApproved() {
        var existing = Invoice.of(4L, new BigDecimal("1000"), MARCH).withId(11L);
        when(invoices.findById(11L)).thenReturn(Optional.of(existing));
        when(commissions.findByInvoiceId(11L)).thenReturn(Optional.of(commission(11L, CommissionStatus.APPROVED)));

        assertThrows(CommissionLockedException.class,
            () -> service.update(Invoice.of(4L, new BigDecimal("2000"), MARCH).withId(11L)));
        verify(invoices, never()).update(any());
    }

    @Test
    void update_refusesMovingInvoiceWithCommissionToAnotherContract() {
        var existing = Invoice.of(4L, new BigDecimal("1000"), MARCH).withId(11L);
        when(invoices.findById(11L)).thenReturn(Optional.of(existing));
        when(commissions.findByInvoiceId(11L)).thenReturn(Optional.of(commission(11L, CommissionStatus.PENDING)));
        when(contracts.findById(5L)).thenReturn(Optional.of(contract.withId(5L)));

        var error = assertThrows(ValidationException.class,
            () -> service.update(Invoice.of(5L, new BigDecimal("1000"), MARCH).withId(11L)));

        assertEquals("CONTRACT_CHANGE_NOT_ALLOWED", error.getErrors().get(0).errorCode());
    }

    @Test
    void backfill_countsFailuresPerInvoice() {
        var first = Invoice.of(4L, new BigDecimal("1000"), MARCH).withId(11L);
        var second = Invoice.of(4L, new BigDecimal("1000"), MARCH).withId(12L);
        when(invoices.findWithoutCommission()).thenReturn(List.of(first, second));
        when(engine.calculateOrGet(first)).thenReturn(commission(11L, CommissionStatus.PENDING));
        when(engine.calculateOrGet(second)).thenThrow(new ConfigNotFoundException(1L, MARCH));

        var result = service.backfillMissingCommissions().get();

        assertEquals(2, result.fetchedCount());
        assertEquals(1, result.createdCount());
        assertEquals(1, result.failedCount());
        assertTrue(result.errors().get(0).startsWith("invoice 12"));
    }

    private static Commission commission(Long invoiceId, CommissionStatus status) {
        var pending = Commission.pending(invoiceId, 1L, 2L, new BigDecimal("100.00"),
            CapResult.uncapped(new BigDecimal("100.00")), BonusBreakdown.none(), LocalDateTime.of(2025, 3, 10, 9, 0)).withId(invoiceId + 100);
        return status == CommissionStatus.APPROVED ? pending.approved("manager", LocalDateTime.now()) : pending;
    }
}
