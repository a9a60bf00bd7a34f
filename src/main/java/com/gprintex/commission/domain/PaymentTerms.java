package com.gprintex.commission.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Contract payment terms. Wire values are lowercase with dashes ("full-upfront").
 */
public enum PaymentTerms {
    ANNUAL,
    QUARTERLY,
    MONTHLY,
    UPFRONT,
    FULL_UPFRONT;

    /**
     * Full and partial upfront payment both qualify for the upfront bonus.
     */
    public boolean isUpfront() {
        return this == UPFRONT || this == FULL_UPFRONT;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    @JsonCreator
    public static PaymentTerms fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Payment terms are required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid payment terms: " + value);
        }
    }
}
