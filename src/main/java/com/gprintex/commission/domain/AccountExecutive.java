package com.gprintex.commission.domain;

import java.util.Optional;

/**
 * Account executive directory entry.
 */
public record AccountExecutive(
    Optional<Long> id,
    String name,
    String email,
    boolean active
) {
    public AccountExecutive {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email is required");
        }
        id = id != null ? id : Optional.empty();
    }

    public static AccountExecutive of(String name, String email) {
        return new AccountExecutive(Optional.empty(), name, email, true);
    }

    public AccountExecutive withId(Long newId) {
        return new AccountExecutive(Optional.ofNullable(newId), name, email, active);
    }
}
