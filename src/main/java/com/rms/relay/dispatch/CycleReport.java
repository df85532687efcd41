package com.rms.relay.dispatch;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * In-memory summary of one dispatch cycle. Logged once and served by the status endpoint.
 *
 * @param status            cycle result
 * @param previousWatermark watermark before the cycle; {@code null} when none was stored or it could not be read
 * @param newWatermark      watermark after the cycle (equal to the previous one unless it advanced)
 * @param fetched           records read from the source
 * @param published         records durably published (whole successful batches only)
 * @param batches           batches attempted
 * @param error             failure description; {@code null} on SUCCESS and EMPTY
 * @param finishedAt        when the cycle completed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CycleReport(
        CycleStatus status,
        Instant previousWatermark,
        Instant newWatermark,
        int fetched,
        int published,
        int batches,
        String error,
        Instant finishedAt) {

    public boolean advanced() {
        return newWatermark != null && (previousWatermark == null || newWatermark.isAfter(previousWatermark));
    }
}
