package com.gprintex.commission.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Invoice against a contract. Each invoice carries exactly one commission.
 */
public record Invoice(
    Optional<Long> id,
    Long contractId,
    Optional<String> invoiceNumber,
    BigDecimal amount,
    LocalDate invoiceDate,
    RevenueType revenueType,
    Optional<String> externalInvoiceId,
    Optional<LocalDateTime> createdAt
) {
    public Invoice {
        if (contractId == null) {
            throw new IllegalArgumentException("contractId is required");
        }
        if (invoiceDate == null) {
            throw new IllegalArgumentException("invoiceDate is required");
        }
        if (amount == null) {
            throw new IllegalArgumentException("amount is required");
        }
        amount = Money.requireNonNegative("amount", amount);
        revenueType = revenueType != null ? revenueType : RevenueType.RECURRING;
        id = id != null ? id : Optional.empty();
        invoiceNumber = invoiceNumber != null ? invoiceNumber : Optional.empty();
        externalInvoiceId = externalInvoiceId != null ? externalInvoiceId : Optional.empty();
        createdAt = createdAt != null ? createdAt : Optional.empty();
    }

    public static Invoice of(Long contractId, BigDecimal amount, LocalDate invoiceDate) {
        return new Invoice(
            Optional.empty(), contractId, Optional.empty(), amount, invoiceDate,
            RevenueType.RECURRING, Optional.empty(), Optional.empty()
        );
    }

    /**
     * OTE year bucket of this invoice.
     */
    public int capYear() {
        return invoiceDate.getYear();
    }

    public Invoice withId(Long newId) {
        return new Invoice(
            Optional.ofNullable(newId), contractId, invoiceNumber, amount, invoiceDate,
            revenueType, externalInvoiceId, createdAt
        );
    }

    public Invoice withRevenueType(RevenueType type) {
        return new Invoice(id, contractId, invoiceNumber, amount, invoiceDate, type, externalInvoiceId, createdAt);
    }

    public Invoice withExternalInvoiceId(String externalId) {
        return new Invoice(
            id, contractId, invoiceNumber, amount, invoiceDate,
            revenueType, Optional.ofNullable(externalId), createdAt
        );
    }
}
