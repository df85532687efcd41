package com.rms.relay.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * =====================================================================
 * EventRecord
 * =====================================================================
 *
 * PURPOSE ------- A raw, append-only event row as read from the source
 * database, before any envelope fields are added.
 *
 * ORDERING ------- {@link #timestamp} is the source clock value the watermark
 * is compared against. The source returns records in ascending timestamp order
 * and the dispatch cycle relies on that order; it is not an optimization.
 *
 * IMMUTABILITY ------------ The payload map is copied and wrapped read-only at
 * construction. Values inside it are whatever the source produced; they are not
 * validated here, serialization problems surface later as a
 * {@code MalformedEventException} during the batch pre-check.
 */
public record EventRecord(

		/** Source-assigned identifier. Also used as the JetStream Msg-Id. */
		String id,

		/** Source timestamp; the ordering key for the watermark. */
		Instant timestamp,

		/** Category tag (the source EVENT_TYPE). */
		String category,

		/** Remaining source columns, in column order. */
		Map<String, Object> payload) {

	public EventRecord {
		Objects.requireNonNull(id, "id");
		Objects.requireNonNull(timestamp, "timestamp");
		payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
	}
}
