package com.rms.relay.core.tracking;

import java.time.Instant;

import com.rms.relay.core.model.RunRecord;
import com.rms.relay.core.model.RunUpdate;

import reactor.core.publisher.Mono;

/**
 * Persists the watermark and run bookkeeping per program name.
 *
 * <p>Implementations must not let a failed write look successful: {@link #saveRun} errors with
 * {@link com.rms.relay.core.error.TrackingStoreWriteException} whenever the row was not written.</p>
 */
public interface RunTracker {

    /** Creates the tracking row in status INITIALIZED when it does not exist yet. */
    Mono<Void> ensureProgram(String programName);

    /** Empty when the program has no tracking row. */
    Mono<RunRecord> findProgram(String programName);

    /** Empty when no cycle has ever advanced the watermark. */
    Mono<Instant> findWatermark(String programName);

    /**
     * Records the result of one cycle. A non-null watermark is stored only if it is later than the
     * stored one.
     */
    Mono<Void> saveRun(RunUpdate update);
}
