package com.gprintex.commission.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gprintex.commission.exception.InvalidTransitionException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Commission approval-to-payout status.
 * The transition table lives here and nowhere else.
 */
public enum CommissionStatus {
    PENDING,
    APPROVED,
    REJECTED,
    PAID;

    /**
     * Check if transition to target status is valid.
     */
    public boolean canTransitionTo(CommissionStatus target) {
        return switch (this) {
            case PENDING -> target == APPROVED || target == REJECTED;
            case APPROVED -> target == PAID;
            case REJECTED, PAID -> false;
        };
    }

    /**
     * Fail with {@link InvalidTransitionException} unless the transition is in the table.
     */
    public void requireTransitionTo(CommissionStatus target, Long commissionId) {
        if (target == null || !canTransitionTo(target)) {
            throw new InvalidTransitionException(commissionId, this, target);
        }
    }

    public List<CommissionStatus> allowedTransitions() {
        return Arrays.stream(values())
            .filter(this::canTransitionTo)
            .toList();
    }

    public boolean isTerminal() {
        return allowedTransitions().isEmpty();
    }

    /**
     * Approved and paid commissions are realized earnings; their figures never change again.
     */
    public boolean isLocked() {
        return this == APPROVED || this == PAID;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CommissionStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Commission status is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid commission status: " + value);
        }
    }
}
