package com.gprintex.commission.repository;

import com.gprintex.commission.domain.Invoice;

import java.util.List;
import java.util.Optional;

/**
 * Repository for invoices.
 */
public interface InvoiceRepository {

    Invoice insert(Invoice invoice);

    boolean update(Invoice invoice);

    Optional<Invoice> findById(Long id);

    /**
     * Lookup of an invoice imported from the external billing system.
     */
    Optional<Invoice> findByExternalId(String externalInvoiceId);

    List<Invoice> findByContract(Long contractId);

    /**
     * Invoices that have no commission row yet, oldest first.
     */
    List<Invoice> findWithoutCommission();
}
