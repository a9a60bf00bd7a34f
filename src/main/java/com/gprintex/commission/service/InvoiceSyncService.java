package com.gprintex.commission.service;

import com.gprintex.commission.client.BillingClient;
import com.gprintex.commission.domain.BatchResult;
import com.gprintex.commission.domain.ExternalInvoice;
import com.gprintex.commission.repository.ContractRepository;
import com.gprintex.commission.repository.InvoiceRepository;
import io.vavr.control.Try;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Imports paid invoices from the external billing system.
 * An external invoice already mapped to a local one is skipped, so re-running a sync never duplicates
 * invoices or commissions.
 */
@Service
public class InvoiceSyncService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceSyncService.class);

    private final BillingClient billingClient;
    private final InvoiceRepository invoices;
    private final ContractRepository contracts;
    private final InvoiceService invoiceService;

    public InvoiceSyncService(
        BillingClient billingClient,
        InvoiceRepository invoices,
        ContractRepository contracts,
        InvoiceService invoiceService
    ) {
        this.billingClient = billingClient;
        this.invoices = invoices;
        this.contracts = contracts;
        this.invoiceService = invoiceService;
    }

    public Try<BatchResult> syncPaidInvoices() {
        return Try.of(billingClient::fetchPaidInvoices)
            .map(this::importAll)
            .onFailure(e -> log.error("Invoice sync failed: {}", e.getMessage()));
    }

    BatchResult importAll(List<ExternalInvoice> fetched) {
        var result = BatchResult.start("billing-sync");
        long created = 0;
        long skipped = 0;
        long failed = 0;
        var errors = new ArrayList<String>();

        for (var external : fetched) {
            switch (importOne(external, errors)) {
                case CREATED -> created++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }
        log.info("Invoice sync finished: fetched={} created={} skipped={} failed={}",
            fetched.size(), created, skipped, failed);
        return result.withCounts(fetched.size(), created, skipped, failed, errors);
    }

    private Outcome importOne(ExternalInvoice external, List<String> errors) {
        if (!external.isPaid()) {
            log.debug("Skipping unpaid external invoice {}", external.externalId());
            return Outcome.SKIPPED;
        }
        var mapped = invoices.findByExternalId(external.externalId());
        if (mapped.isPresent()) {
            log.debug("External invoice {} already mapped to invoice {}", external.externalId(), mapped.get().id().orElse(null));
            return Outcome.SKIPPED;
        }

        var candidates = contracts.findByClientName(external.customerName());
        if (candidates.isEmpty()) {
            errors.add(external.externalId() + ": no contract for customer '" + external.customerName() + "'");
            log.warn("No contract found for customer '{}' (external invoice {})", external.customerName(), external.externalId());
            return Outcome.FAILED;
        }
        if (candidates.size() > 1) {
            log.warn("{} contracts match customer '{}', using the latest", candidates.size(), external.customerName());
        }
        var contract = candidates.get(candidates.size() - 1);

        try {
            return invoiceService.create(external.toInvoice(contract.id().orElseThrow()))
                .fold(
                    validation -> {
                        errors.add(external.externalId() + ": " + validation.get(0).errorMessage());
                        return Outcome.FAILED;
                    },
                    created -> {
                        created.commissionError().ifPresent(code ->
                            errors.add(external.externalId() + ": invoice imported without commission (" + code + ")"));
                        return Outcome.CREATED;
                    }
                );
        } catch (DuplicateKeyException e) {
            log.info("External invoice {} was imported concurrently", external.externalId());
            return Outcome.SKIPPED;
        } catch (RuntimeException e) {
            errors.add(external.externalId() + ": " + e.getMessage());
            log.error("Failed to import external invoice {}", external.externalId(), e);
            return Outcome.FAILED;
        }
    }

    private enum Outcome {
        CREATED,
        SKIPPED,
        FAILED
    }
}
