package com.gprintex.commission.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Sales contract booked by an AE. Functional style with Optional for nullable fields.
 */
public record Contract(
    Optional<Long> id,
    String clientName,
    Long aeId,
    BigDecimal totalValue,
    BigDecimal acv,
    ContractType contractType,
    int contractLength,
    PaymentTerms paymentTerms,
    boolean isPilot,
    Optional<LocalDateTime> createdAt,
    Optional<LocalDateTime> updatedAt
) {
    // Compact constructor for validation
    public Contract {
        if (clientName == null || clientName.isBlank()) {
            throw new IllegalArgumentException("clientName is required");
        }
        if (aeId == null) {
            throw new IllegalArgumentException("aeId is required");
        }
        if (contractLength < 1) {
            throw new IllegalArgumentException("contractLength must be at least 1 year");
        }
        totalValue = Money.requireNonNegative("totalValue", totalValue);
        acv = Money.requireNonNegative("acv", acv);
        contractType = contractType != null ? contractType : ContractType.NEW;
        paymentTerms = paymentTerms != null ? paymentTerms : PaymentTerms.ANNUAL;
        id = id != null ? id : Optional.empty();
        createdAt = createdAt != null ? createdAt : Optional.empty();
        updatedAt = updatedAt != null ? updatedAt : Optional.empty();
    }

    /**
     * Factory for a new one-year annual contract.
     */
    public static Contract of(String clientName, Long aeId, BigDecimal totalValue) {
        return new Contract(
            Optional.empty(), clientName, aeId, totalValue, totalValue,
            ContractType.NEW, 1, PaymentTerms.ANNUAL, false,
            Optional.empty(), Optional.empty()
        );
    }

    public boolean isMultiYear() {
        return contractLength > 1;
    }

    public Contract withId(Long newId) {
        return new Contract(
            Optional.ofNullable(newId), clientName, aeId, totalValue, acv, contractType,
            contractLength, paymentTerms, isPilot, createdAt, updatedAt
        );
    }

    public Contract withTerms(int length, PaymentTerms terms) {
        return new Contract(
            id, clientName, aeId, totalValue, acv, contractType,
            length, terms, isPilot, createdAt, updatedAt
        );
    }

    public Contract withPilot(boolean pilot) {
        return new Contract(
            id, clientName, aeId, totalValue, acv, contractType,
            contractLength, paymentTerms, pilot, createdAt, updatedAt
        );
    }
}
