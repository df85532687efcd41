package com.rms.relay.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Bus-ready wrapper around one {@link EventRecord}.
 *
 * <p>Envelopes live for one dispatch cycle only and are never persisted. The JSON produced from
 * this record is the wire contract of the relay:</p>
 *
 * <pre>
 * { "event_id", "category", "trace_id", "data_type", "event_time", "formatted_at", "payload" }
 * </pre>
 */
@JsonPropertyOrder({ "event_id", "category", "trace_id", "data_type", "event_time", "formatted_at", "payload" })
public record DispatchEnvelope(
        @JsonIgnore EventRecord record,
        @JsonProperty("trace_id") UUID traceId,
        @JsonProperty("data_type") String dataType,
        @JsonProperty("formatted_at") Instant formattedAt) {

    @JsonProperty("event_id")
    public String eventId() {
        return record.id();
    }

    @JsonProperty("category")
    public String category() {
        return record.category();
    }

    @JsonProperty("event_time")
    public Instant eventTime() {
        return record.timestamp();
    }

    @JsonProperty("payload")
    public Map<String, Object> payload() {
        return record.payload();
    }
}
