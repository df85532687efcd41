package com.rms.relay.jetstream.publisher;

import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.relay.core.error.MalformedEventException;
import com.rms.relay.core.model.DispatchEnvelope;

import io.nats.client.impl.Headers;

/**
 * Turns a {@link DispatchEnvelope} into the bytes and headers of a JetStream message.
 *
 * <p>The body is the envelope's JSON (UTF-8). The trace id and data type are repeated as headers so
 * consumers can route without parsing the body.</p>
 */
public class EnvelopeSerializer {

    public static final String TRACE_ID_HEADER = "trace-id";
    public static final String DATA_TYPE_HEADER = "data-type";

    private final ObjectMapper mapper;
    private final int maxPayloadBytes;

    public EnvelopeSerializer(ObjectMapper mapper, int maxPayloadBytes) {
        if (maxPayloadBytes <= 0) {
            throw new IllegalArgumentException("maxPayloadBytes must be positive, got " + maxPayloadBytes);
        }
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.maxPayloadBytes = maxPayloadBytes;
    }

    /**
     * Serializes the envelope and checks its size.
     *
     * @param serverMaxPayload limit announced by the server, or a non-positive value when unknown
     * @throws MalformedEventException when the envelope cannot be serialized or is too large
     */
    public byte[] serialize(DispatchEnvelope envelope, long serverMaxPayload) {
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException(envelope.eventId(),
                    "Event " + envelope.eventId() + " is not serializable: " + e.getOriginalMessage(), e);
        }

        long limit = serverMaxPayload > 0 ? Math.min(maxPayloadBytes, serverMaxPayload) : maxPayloadBytes;
        if (body.length > limit) {
            throw new MalformedEventException(envelope.eventId(),
                    "Event " + envelope.eventId() + " is " + body.length + " bytes, limit is " + limit, null);
        }
        return body;
    }

    public Headers headers(DispatchEnvelope envelope) {
        return new Headers()
                .add(TRACE_ID_HEADER, envelope.traceId().toString())
                .add(DATA_TYPE_HEADER, envelope.dataType());
    }

    public int getMaxPayloadBytes() {
        return maxPayloadBytes;
    }
}
