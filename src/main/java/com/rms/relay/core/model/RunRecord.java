package com.rms.relay.core.model;

import java.time.Instant;

/**
 * Stored tracking row for one program.
 *
 * <p>{@code lastSuccessfulTime} is the watermark; everything else is bookkeeping for operators and
 * is never used for correctness decisions.</p>
 */
public record RunRecord(
        String programName,
        Instant lastSuccessfulTime,
        Instant lastRunTime,
        RunStatus status,
        long recordsProcessed,
        long totalRecordsProcessed,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt) {

    public boolean isSuccessful() {
        return status == RunStatus.SUCCESS;
    }

    public boolean isFailed() {
        return status == RunStatus.FAILED;
    }

    public boolean hasRunBefore() {
        return lastSuccessfulTime != null;
    }
}
