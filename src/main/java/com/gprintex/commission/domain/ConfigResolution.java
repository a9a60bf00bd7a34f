package com.gprintex.commission.domain;

import java.util.Optional;

/**
 * Outcome of resolving the commission plan for an AE on a date.
 */
public record ConfigResolution(
    CommissionConfig config,
    Source source,
    Optional<Long> assignmentId,
    Optional<IntegrityWarning> warning
) {
    public enum Source {
        ASSIGNMENT,
        SYSTEM_DEFAULT
    }

    public ConfigResolution {
        if (config == null) {
            throw new IllegalArgumentException("config is required");
        }
        assignmentId = assignmentId != null ? assignmentId : Optional.empty();
        warning = warning != null ? warning : Optional.empty();
    }

    public static ConfigResolution assigned(CommissionConfig config, Long assignmentId) {
        return new ConfigResolution(config, Source.ASSIGNMENT, Optional.ofNullable(assignmentId), Optional.empty());
    }

    public static ConfigResolution fallback(CommissionConfig config) {
        return new ConfigResolution(config, Source.SYSTEM_DEFAULT, Optional.empty(), Optional.empty());
    }

    public ConfigResolution withWarning(IntegrityWarning integrityWarning) {
        return new ConfigResolution(config, source, assignmentId, Optional.ofNullable(integrityWarning));
    }

    public boolean isFallback() {
        return source == Source.SYSTEM_DEFAULT;
    }
}
