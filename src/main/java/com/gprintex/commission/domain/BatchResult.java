package com.gprintex.commission.domain;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Counts of a batch run such as a backfill or an external invoice sync.
 */
public record BatchResult(
    String source,
    LocalDateTime startedAt,
    long fetchedCount,
    long createdCount,
    long skippedCount,
    long failedCount,
    List<String> errors
) {
    public BatchResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static BatchResult start(String source) {
        return new BatchResult(source, LocalDateTime.now(), 0, 0, 0, 0, List.of());
    }

    public BatchResult withCounts(long fetched, long created, long skipped, long failed, List<String> errorMessages) {
        return new BatchResult(source, startedAt, fetched, created, skipped, failed, errorMessages);
    }

    public boolean hasErrors() {
        return failedCount > 0;
    }

    public double successRate() {
        if (fetchedCount <= 0) return 0;
        long effective = Math.max(0, Math.min(createdCount + skippedCount, fetchedCount));
        return (double) effective / fetchedCount * 100;
    }
}
