package com.rms.relay.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One write to the tracking store at the end of a dispatch cycle.
 *
 * @param programName      tracking key
 * @param watermark        new watermark, or {@code null} to leave the stored one untouched
 * @param status           {@link RunStatus#SUCCESS} or {@link RunStatus#FAILED}
 * @param recordsProcessed records durably published in this cycle
 * @param errorMessage     failure description; {@code null} on success
 */
public record RunUpdate(String programName, Instant watermark, RunStatus status, int recordsProcessed,
        String errorMessage) {

    public RunUpdate {
        Objects.requireNonNull(programName, "programName");
        Objects.requireNonNull(status, "status");
        if (recordsProcessed < 0) {
            throw new IllegalArgumentException("recordsProcessed must be >= 0, got " + recordsProcessed);
        }
    }

    public static RunUpdate success(String programName, Instant watermark, int recordsProcessed) {
        return new RunUpdate(programName, watermark, RunStatus.SUCCESS, recordsProcessed, null);
    }

    public static RunUpdate failure(String programName, Instant watermark, int recordsProcessed, String errorMessage) {
        return new RunUpdate(programName, watermark, RunStatus.FAILED, recordsProcessed, errorMessage);
    }
}
