package com.gprintex.commission.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ContractType {
    NEW,
    RENEWAL,
    UPSELL;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ContractType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Contract type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid contract type: " + value);
        }
    }
}
