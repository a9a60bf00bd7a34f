package com.gprintex.commission.service;

import com.gprintex.commission.client.BillingClient;
import com.gprintex.commission.domain.Contract;
import com.gprintex.commission.domain.ExternalInvoice;
import com.gprintex.commission.domain.Invoice;
import com.gprintex.commission.domain.InvoiceResult;
import com.gprintex.commission.domain.ValidationResult;
import com.gprintex.commission.repository.ContractRepository;
import com.gprintex.commission.repository.InvoiceRepository;
import io.vavr.control.Either;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InvoiceSyncServiceTests {

    @Mock private BillingClient billingClient;
    @Mock private InvoiceRepository invoices;
    @Mock private ContractRepository contracts;
    @Mock private InvoiceService invoiceService;

    private InvoiceSyncService syncService;

    private final Contract acme = Contract.of("Acme", 1L, new BigDecimal("100000")).withId(3L);

    @BeforeEach
    void setUp() {
        syncService = new InvoiceSyncService(billingClient, invoices, contracts, invoiceService);
    }

    @Test
    void sync_importsPaidInvoiceMappedByCustomerName() {
        when(billingClient.fetchPaidInvoices()).thenReturn(List.of(external("inv_1", "acme", "paid")));
        when(invoices.findByExternalId("inv_1")).thenReturn(Optional.empty());
        when(contracts.findByClientName("acme")).thenReturn(List.of(acme));
        when(invoiceService.create(any())).thenAnswer(inv ->
            Either.right(InvoiceResult.withoutCommission(inv.<Invoice>getArgument(0).withId(9L), null)));

        var result = syncService.syncPaidInvoices().get();

        assertEquals(1, result.fetchedCount());
        assertEquals(1, result.createdCount());
        assertFalse(result.hasErrors());
        var created = ArgumentCaptor.forClass(Invoice.class);
        verify(invoiceService).create(created.capture());
        assertEquals(3L, created.getValue().contractId());
        assertEquals(Optional.of("inv_1"), created.getValue().externalInvoiceId());
    }

    @Test
    void sync_skipsAlreadyImportedAndUnpaid() {
        when(billingClient.fetchPaidInvoices()).thenReturn(List.of(
            external("inv_1", "Acme", "paid"),
            external("inv_2", "Acme", "open")
        ));
        when(invoices.findByExternalId("inv_1"))
            .thenReturn(Optional.of(Invoice.of(3L, BigDecimal.TEN, LocalDate.of(2025, 1, 1)).withId(9L)));

        var result = syncService.syncPaidInvoices().get();

        assertEquals(2, result.skippedCount());
        assertEquals(0, result.createdCount());
        verifyNoInteractions(invoiceService);
    }

    @Test
    void sync_unknownCustomerCountsAsFailure() {
        when(billingClient.fetchPaidInvoices()).thenReturn(List.of(external("inv_1", "Nobody", "paid")));
        when(invoices.findByExternalId("inv_1")).thenReturn(Optional.empty());
        when(contracts.findByClientName("Nobody")).thenReturn(List.of());

        var result = syncService.syncPaidInvoices().get();

        assertEquals(1, result.failedCount());
        assertTrue(result.errors().get(0).contains("Nobody"));
    }

    @Test
    void sync_concurrentImportCountsAsSkipped() {
        when(billingClient.fetchPaidInvoices()).thenReturn(List.of(external("inv_1", "Acme", "paid")));
        when(invoices.findByExternalId("inv_1")).thenReturn(Optional.empty());
        when(contracts.findByClientName("Acme")).thenReturn(List.of(acme));
        when(invoiceService.create(any())).thenThrow(new DuplicateKeyException("uq_invoice_external"));

        var result = syncService.syncPaidInvoices().get();

        assertEquals(1, result.skippedCount());
        assertEquals(0, result.failedCount());
    }

    @Test
    void sync_validationFailureIsReported() {
        when(billingClient.fetchPaidInvoices()).thenReturn(List.of(external("inv_1", "Acme", "paid")));
        when(invoices.findByExternalId("inv_1")).thenReturn(Optional.empty());
        when(contracts.findByClientName("Acme")).thenReturn(List.of(acme));
        when(invoiceService.create(any())).thenReturn(Either.left(List.of(
            ValidationResult.error("CONTRACT_NOT_FOUND", "Contract 3 does not exist", "contractId"))));

        var result = syncService.syncPaidInvoices().get();

        assertEquals(1, result.failedCount());
        assertTrue(result.errors().get(0).contains("Contract 3 does not exist"));
    }

    @Test
    void sync_billingFailureIsFailure() {
        when(billingClient.fetchPaidInvoices())
            .thenThrow(new BillingClient.BillingApiException("Billing API call failed", 503, ""));

        var result = syncService.syncPaidInvoices();

        assertTrue(result.isFailure());
        assertInstanceOf(BillingClient.BillingApiException.class, result.getCause());
    }

    private static ExternalInvoice external(String id, String customer, String status) {
        return new ExternalInvoice(id, customer, Optional.empty(), new BigDecimal("1000.00"),
            LocalDate.of(2025, 2, 1), status, Optional.empty());
    }
}
