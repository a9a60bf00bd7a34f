package com.gprintex.commission.domain;

import java.util.Optional;

/**
 * An invoice together with the outcome of its commission calculation.
 * When the calculation failed the invoice is kept and the error code explains why.
 */
public record InvoiceResult(
    Invoice invoice,
    Optional<Commission> commission,
    Optional<String> commissionError
) {
    public InvoiceResult {
        commission = commission != null ? commission : Optional.empty();
        commissionError = commissionError != null ? commissionError : Optional.empty();
    }

    public static InvoiceResult of(Invoice invoice, Commission commission) {
        return new InvoiceResult(invoice, Optional.of(commission), Optional.empty());
    }

    public static InvoiceResult withoutCommission(Invoice invoice, String error) {
        return new InvoiceResult(invoice, Optional.empty(), Optional.ofNullable(error));
    }
}
