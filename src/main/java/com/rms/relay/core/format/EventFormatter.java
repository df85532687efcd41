package com.rms.relay.core.format;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

import com.rms.relay.core.model.DispatchEnvelope;
import com.rms.relay.core.model.EventRecord;

/**
 * Maps a source record to a bus envelope.
 *
 * <p>Stateless apart from the configured data-type tag. Each call generates a fresh random (v4)
 * trace id and stamps the formatting time from the injected clock; nothing else varies between
 * calls for the same record.</p>
 */
public class EventFormatter {

    private final String dataType;
    private final Clock clock;

    public EventFormatter(String dataType, Clock clock) {
        if (dataType == null || dataType.isBlank()) {
            throw new IllegalArgumentException("dataType is required");
        }
        this.dataType = dataType;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public DispatchEnvelope format(EventRecord record) {
        Objects.requireNonNull(record, "record");
        return new DispatchEnvelope(record, UUID.randomUUID(), dataType, clock.instant());
    }
}
