package com.gprintex.commission.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Invoice as delivered by the external billing system.
 */
public record ExternalInvoice(
    String externalId,
    String customerName,
    Optional<String> invoiceNumber,
    BigDecimal amount,
    LocalDate invoiceDate,
    String status,
    Optional<RevenueType> revenueType
) {
    public static final String STATUS_PAID = "PAID";

    public ExternalInvoice {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("externalId is required");
        }
        invoiceNumber = invoiceNumber != null ? invoiceNumber : Optional.empty();
        revenueType = revenueType != null ? revenueType : Optional.empty();
    }

    public boolean isPaid() {
        return STATUS_PAID.equalsIgnoreCase(status);
    }

    public Invoice toInvoice(Long contractId) {
        return new Invoice(
            Optional.empty(), contractId, invoiceNumber, amount, invoiceDate,
            revenueType.orElse(RevenueType.RECURRING), Optional.of(externalId), Optional.empty()
        );
    }
}
