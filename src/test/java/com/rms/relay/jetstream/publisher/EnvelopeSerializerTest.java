package com.rms.relay.jetstream.publisher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.relay.config.JacksonConfig;
import com.rms.relay.core.error.MalformedEventException;
import com.rms.relay.core.model.DispatchEnvelope;
import com.rms.relay.support.Events;

import io.nats.client.impl.Headers;

class EnvelopeSerializerTest {

    private final ObjectMapper mapper = JacksonConfig.relayObjectMapper();
    private final EnvelopeSerializer serializer = new EnvelopeSerializer(mapper, 1024 * 1024);

    @Test
    @DisplayName("body is the envelope JSON with snake_case fields and ISO-8601 times")
    void wireFormat() throws Exception {
        DispatchEnvelope envelope = Events.envelope("42");

        JsonNode json = mapper.readTree(serializer.serialize(envelope, -1));

        List<String> fields = iterableToList(json.fieldNames());
        assertThat(fields).containsExactly("event_id", "category", "trace_id", "data_type", "event_time",
                "formatted_at", "payload");
        assertThat(json.get("event_id").asText()).isEqualTo("42");
        assertThat(json.get("trace_id").asText()).isEqualTo(envelope.traceId().toString());
        assertThat(json.get("data_type").asText()).isEqualTo("TXLOG");
        assertThat(json.get("event_time").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(json.get("payload").get("case_id").asText()).isEqualTo("C-42");
        assertThat(json.has("record")).isFalse();
    }

    @Test
    void headersCarryTraceIdAndDataType() {
        DispatchEnvelope envelope = Events.envelope("42");

        Headers headers = serializer.headers(envelope);

        assertThat(headers.getFirst(EnvelopeSerializer.TRACE_ID_HEADER)).isEqualTo(envelope.traceId().toString());
        assertThat(headers.getFirst(EnvelopeSerializer.DATA_TYPE_HEADER)).isEqualTo("TXLOG");
    }

    @Test
    @DisplayName("an unserializable payload is a MalformedEventException naming the event")
    void unserializable() {
        assertThatThrownBy(() -> serializer.serialize(Events.unserializable("bad-1"), -1))
                .isInstanceOf(MalformedEventException.class)
                .hasMessageContaining("bad-1")
                .satisfies(e -> assertThat(((MalformedEventException) e).getEventId()).isEqualTo("bad-1"));
    }

    @Test
    @DisplayName("the lower of the configured and server limits applies")
    void sizeLimit() {
        DispatchEnvelope envelope = Events.envelope("42");
        int size = serializer.serialize(envelope, -1).length;

        assertThatThrownBy(() -> new EnvelopeSerializer(mapper, size - 1).serialize(envelope, -1))
                .isInstanceOf(MalformedEventException.class);
        assertThatThrownBy(() -> serializer.serialize(envelope, size - 1))
                .isInstanceOf(MalformedEventException.class);
        assertThat(new EnvelopeSerializer(mapper, size).serialize(envelope, size)).hasSize(size);
    }

    private static List<String> iterableToList(java.util.Iterator<String> it) {
        List<String> out = new java.util.ArrayList<>();
        it.forEachRemaining(out::add);
        return out;
    }
}
