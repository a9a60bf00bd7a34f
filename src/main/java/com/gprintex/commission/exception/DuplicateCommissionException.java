package com.gprintex.commission.exception;

import com.gprintex.commission.domain.Commission;

import java.util.Optional;

/**
 * A commission already exists for the invoice. Carries the existing record so callers can recover.
 */
public class DuplicateCommissionException extends CommissionException {

    private final Long invoiceId;
    private final transient Commission existing;

    public DuplicateCommissionException(Long invoiceId, Commission existing) {
        super("DUPLICATE_COMMISSION", "Commission already exists for invoice " + invoiceId);
        this.invoiceId = invoiceId;
        this.existing = existing;
    }

    public Long getInvoiceId() {
        return invoiceId;
    }

    public Optional<Commission> getExisting() {
        return Optional.ofNullable(existing);
    }
}
