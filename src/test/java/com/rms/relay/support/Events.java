package com.rms.relay.support;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.rms.relay.core.format.EventFormatter;
import com.rms.relay.core.model.DispatchEnvelope;
import com.rms.relay.core.model.EventRecord;

/**
 * Test fixtures for records and envelopes.
 */
public final class Events {

    public static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
    public static final EventFormatter FORMATTER = new EventFormatter("TXLOG", CLOCK);

    private Events() {
    }

    public static EventRecord record(String id, Instant timestamp) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("case_id", "C-" + id);
        payload.put("event_type", "CASE_UPDATED");
        payload.put("event_data", "{\"n\":" + id.hashCode() + "}");
        return new EventRecord(id, timestamp, "CASE_UPDATED", payload);
    }

    /** {@code count} records one second apart, starting one second after {@code after}. */
    public static List<EventRecord> records(String prefix, Instant after, int count) {
        List<EventRecord> out = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            out.add(record(prefix + i, after.plusSeconds(i)));
        }
        return out;
    }

    public static DispatchEnvelope envelope(String id) {
        return FORMATTER.format(record(id, T0));
    }

    public static List<DispatchEnvelope> envelopes(int count) {
        List<DispatchEnvelope> out = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            out.add(envelope("e" + i));
        }
        return out;
    }

    /** Envelope whose payload Jackson cannot serialize. */
    public static DispatchEnvelope unserializable(String id) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("case_id", new Object());
        return FORMATTER.format(new EventRecord(id, T0, "CASE_UPDATED", payload));
    }
}
