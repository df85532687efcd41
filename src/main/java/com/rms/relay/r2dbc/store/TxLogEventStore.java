package com.rms.relay.r2dbc.store;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.rms.relay.config.RelayProperties;
import com.rms.relay.core.error.SourceUnavailableException;
import com.rms.relay.core.model.EventRecord;
import com.rms.relay.core.retry.RetryExecutor;
import com.rms.relay.core.source.EventSource;
import com.rms.relay.r2dbc.config.R2dbcConfig;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only access to the transaction-log table (default {@code spc.TXLOG_EVENTS}).
 *
 * <p>Columns are read by name. {@code ID} becomes the event id, {@code CREATED_AT} the ordering
 * timestamp, {@code EVENT_TYPE} the category; the payload carries {@code case_id},
 * {@code event_type}, {@code event_data} and {@code event_timestamp}.</p>
 *
 * <p>The timestamp columns carry no zone. They are converted with the configured
 * {@code relay.source.zone-id}, both when binding the watermark and when reading rows.</p>
 */
@Repository
public class TxLogEventStore implements EventSource {

	private static final Logger log = LoggerFactory.getLogger(TxLogEventStore.class);

	static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z0-9_.]+");

	private final DatabaseClient db;
	private final String table;
	private final String sql;
	private final ZoneId zone;
	private final RetryExecutor retry;

	public TxLogEventStore(@Qualifier(R2dbcConfig.SOURCE) DatabaseClient db, RelayProperties props) {
		RelayProperties.Database source = props.getSource();
		this.db = db;
		this.table = requireTableName(source.getTable());
		this.zone = source.getZoneId();
		this.retry = source.getRetry().toExecutor("source-fetch", R2dbcErrors::isTransient);
		this.sql = "SELECT ID, CASE_ID, EVENT_TYPE, EVENT_DATA, EVENT_TIMESTAMP, CREATED_AT FROM " + table
				+ " WHERE CREATED_AT > :since ORDER BY CREATED_AT ASC FETCH FIRST :limit ROWS ONLY";
	}

	@Override
	public Flux<EventRecord> fetchSince(Instant watermark, int limit) {
		if (limit <= 0) {
			throw new IllegalArgumentException("limit must be positive, got " + limit);
		}
		LocalDateTime since = LocalDateTime.ofInstant(watermark == null ? Instant.EPOCH : watermark, zone);

		// The whole result is one attempt, so a retry never re-emits rows.
		Mono<List<EventRecord>> query = Mono.defer(() -> db.sql(sql).bind("since", since).bind("limit", limit)
				.map((row, meta) -> toRecord(row)).all().collectList());

		return retry.apply(query)
				.onErrorMap(e -> !(e instanceof SourceUnavailableException),
						e -> new SourceUnavailableException("Reading " + table + " since " + since + " failed", e))
				.doOnNext(records -> log.debug("Fetched {} record(s) from {} since {}", records.size(), table, since))
				.flatMapMany(Flux::fromIterable);
	}

	private EventRecord toRecord(Row row) {
		String id = asString(row.get("ID"));
		LocalDateTime createdAt = row.get("CREATED_AT", LocalDateTime.class);
		String eventType = row.get("EVENT_TYPE", String.class);

		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("case_id", normalize(row.get("CASE_ID")));
		payload.put("event_type", eventType);
		payload.put("event_data", row.get("EVENT_DATA", String.class));
		payload.put("event_timestamp", normalize(row.get("EVENT_TIMESTAMP")));

		return new EventRecord(id, createdAt == null ? null : createdAt.atZone(zone).toInstant(), eventType, payload);
	}

	/**
	 * Keeps JSON-native values; converts database time types to instants and anything else to text.
	 */
	private Object normalize(Object v) {
		if (v == null || v instanceof String || v instanceof Number || v instanceof Boolean) {
			return v;
		}
		if (v instanceof LocalDateTime ldt) {
			return ldt.atZone(zone).toInstant();
		}
		if (v instanceof OffsetDateTime odt) {
			return odt.toInstant();
		}
		if (v instanceof ZonedDateTime zdt) {
			return zdt.toInstant();
		}
		return String.valueOf(v);
	}

	private static String asString(Object v) {
		if (v == null)
			return null;
		if (v instanceof String s)
			return s;
		return String.valueOf(v);
	}

	static String requireTableName(String table) {
		if (table == null || !TABLE_NAME.matcher(table).matches()) {
			throw new IllegalArgumentException("Invalid table name: " + table);
		}
		return table;
	}
}
