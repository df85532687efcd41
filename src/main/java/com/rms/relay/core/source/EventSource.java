package com.rms.relay.core.source;

import java.time.Instant;

import com.rms.relay.core.model.EventRecord;

import reactor.core.publisher.Flux;

/**
 * Read side of the relay: append-only events newer than a watermark.
 */
public interface EventSource {

    /**
     * Returns at most {@code limit} records with {@code timestamp > watermark}, in ascending
     * timestamp order. Fails with {@link com.rms.relay.core.error.SourceUnavailableException} when
     * the source cannot be read after the reader's own retries.
     */
    Flux<EventRecord> fetchSince(Instant watermark, int limit);
}
