package com.gprintex.commission.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Revenue classification of an invoice.
 */
public enum RevenueType {
    RECURRING,
    NON_RECURRING,
    SERVICE;

    /**
     * Only recurring revenue earns commission; other invoices get a zero commission record.
     */
    public boolean isCommissionable() {
        return this == RECURRING;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    @JsonCreator
    public static RevenueType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Revenue type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid revenue type: " + value);
        }
    }
}
