package com.rms.relay.r2dbc.store;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.rms.relay.config.RelayProperties;
import com.rms.relay.core.error.TrackingStoreWriteException;
import com.rms.relay.core.model.RunRecord;
import com.rms.relay.core.model.RunStatus;
import com.rms.relay.core.model.RunUpdate;
import com.rms.relay.core.retry.RetryExecutor;
import com.rms.relay.core.tracking.RunTracker;
import com.rms.relay.r2dbc.config.R2dbcConfig;
import com.rms.relay.r2dbc.entity.ProgramRecordEntity;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Mono;

/**
 * R2DBC {@link RunTracker} over the program tracking table (default {@code ETL_PRMREC}).
 *
 * <h2>Watermark monotonicity</h2>
 * The watermark column is only ever moved forward by the database itself:
 * <pre>
 * UPDATE ... SET LAST_SUCCESSFUL_TIME = :wm
 *  WHERE PROGRAM_NAME = :name AND (LAST_SUCCESSFUL_TIME IS NULL OR LAST_SUCCESSFUL_TIME &lt; :wm)
 * </pre>
 * so a stale writer can never move it back. The run bookkeeping update and the watermark update
 * share one transaction.
 *
 * <h2>Failures</h2>
 * Transient database errors are retried. A write that still fails, or that matches no row, is a
 * {@link TrackingStoreWriteException}.
 */
@Repository
public class ProgramRecordStore implements RunTracker {

	private static final Logger log = LoggerFactory.getLogger(ProgramRecordStore.class);

	static final int MAX_ERROR_LENGTH = 500;

	private final DatabaseClient db;
	private final TransactionalOperator tx;
	private final Clock clock;
	private final String table;
	private final ZoneId zone;
	private final RetryExecutor readRetry;
	private final RetryExecutor writeRetry;

	public ProgramRecordStore(@Qualifier(R2dbcConfig.TRACKING) DatabaseClient db, TransactionalOperator tx,
			RelayProperties props, Clock clock) {
		RelayProperties.Database tracking = props.getTracking();
		this.db = db;
		this.tx = tx;
		this.clock = clock;
		this.table = TxLogEventStore.requireTableName(tracking.getTable());
		this.zone = tracking.getZoneId();
		this.readRetry = tracking.getRetry().toExecutor("tracking-read", R2dbcErrors::isTransient);
		this.writeRetry = tracking.getRetry().toExecutor("tracking-write", R2dbcErrors::isTransient);
	}

	@Override
	public Mono<Void> ensureProgram(String programName) {
		return findProgram(programName).hasElement().flatMap(exists -> {
			if (exists) {
				log.debug("Program record exists: {}", programName);
				return Mono.<Void>empty();
			}
			return insertProgram(programName);
		});
	}

	private Mono<Void> insertProgram(String programName) {
		String sql = "INSERT INTO " + table + " (PROGRAM_NAME, STATUS, RECORDS_PROCESSED, TOTAL_RECORDS_PROCESSED, "
				+ "CREATED_AT, UPDATED_AT) VALUES (:name, :status, 0, 0, :created_at, :updated_at)";

		Mono<Void> insert = Mono.defer(() -> {
			LocalDateTime now = now();
			return db.sql(sql).bind("name", programName).bind("status", RunStatus.INITIALIZED.name())
					.bind("created_at", now).bind("updated_at", now).fetch().rowsUpdated()
					.doOnNext(n -> log.info("Created program record: {}", programName)).then();
		});

		return writeRetry.apply(insert)
				.onErrorResume(DuplicateKeyException.class, e -> {
					log.debug("Program record {} created concurrently", programName);
					return Mono.empty();
				})
				.onErrorMap(e -> !(e instanceof TrackingStoreWriteException),
						e -> new TrackingStoreWriteException("Failed to create program record " + programName, e));
	}

	@Override
	public Mono<RunRecord> findProgram(String programName) {
		String sql = "SELECT PROGRAM_NAME, LAST_SUCCESSFUL_TIME, LAST_RUN_TIME, STATUS, RECORDS_PROCESSED, "
				+ "TOTAL_RECORDS_PROCESSED, ERROR_MESSAGE, CREATED_AT, UPDATED_AT FROM " + table
				+ " WHERE PROGRAM_NAME = :name";

		return readRetry.apply(Mono.defer(() -> db.sql(sql).bind("name", programName)
				.map((row, meta) -> toEntity(row)).one()))
				.map(this::toModel);
	}

	@Override
	public Mono<Instant> findWatermark(String programName) {
		return findProgram(programName)
				.flatMap(r -> Mono.justOrEmpty(r.lastSuccessfulTime()));
	}

	@Override
	public Mono<Void> saveRun(RunUpdate update) {
		String runSql = "UPDATE " + table + " SET LAST_RUN_TIME = :run_time, STATUS = :status, "
				+ "RECORDS_PROCESSED = :processed, TOTAL_RECORDS_PROCESSED = TOTAL_RECORDS_PROCESSED + :total_delta, "
				+ "ERROR_MESSAGE = :error, UPDATED_AT = :updated_at WHERE PROGRAM_NAME = :name";
		String watermarkSql = "UPDATE " + table + " SET LAST_SUCCESSFUL_TIME = :wm WHERE PROGRAM_NAME = :name "
				+ "AND (LAST_SUCCESSFUL_TIME IS NULL OR LAST_SUCCESSFUL_TIME < :wm_guard)";

		Mono<Void> write = Mono.defer(() -> {
			LocalDateTime now = now();
			DatabaseClient.GenericExecuteSpec run = db.sql(runSql).bind("run_time", now)
					.bind("status", update.status().name()).bind("processed", (long) update.recordsProcessed())
					.bind("total_delta", (long) update.recordsProcessed()).bind("updated_at", now)
					.bind("name", update.programName());

			String error = truncate(update.errorMessage());
			if (error == null) {
				run = run.bindNull("error", String.class);
			} else {
				run = run.bind("error", error);
			}

			Mono<Void> runUpdate = run.fetch().rowsUpdated().flatMap(rows -> rows == 1
					? Mono.<Void>empty()
					: Mono.error(new TrackingStoreWriteException(
							"Run update for " + update.programName() + " matched " + rows + " row(s)")));

			if (update.watermark() == null) {
				return tx.transactional(runUpdate);
			}

			LocalDateTime wm = LocalDateTime.ofInstant(update.watermark(), zone);
			Mono<Void> watermarkUpdate = db.sql(watermarkSql).bind("wm", wm).bind("wm_guard", wm)
					.bind("name", update.programName()).fetch().rowsUpdated()
					.doOnNext(rows -> {
						if (rows == 0) {
							log.debug("Watermark {} for {} not newer than stored value; kept", wm, update.programName());
						}
					}).then();

			return tx.transactional(runUpdate.then(watermarkUpdate));
		});

		return writeRetry.apply(write)
				.onErrorMap(e -> !(e instanceof TrackingStoreWriteException),
						e -> new TrackingStoreWriteException("Failed to save run for " + update.programName(), e));
	}

	private ProgramRecordEntity toEntity(Row row) {
		ProgramRecordEntity e = new ProgramRecordEntity();
		e.setProgramName(row.get("PROGRAM_NAME", String.class));
		e.setLastSuccessfulTime(row.get("LAST_SUCCESSFUL_TIME", LocalDateTime.class));
		e.setLastRunTime(row.get("LAST_RUN_TIME", LocalDateTime.class));
		e.setStatus(row.get("STATUS", String.class));
		e.setRecordsProcessed(asLong(row.get("RECORDS_PROCESSED")));
		e.setTotalRecordsProcessed(asLong(row.get("TOTAL_RECORDS_PROCESSED")));
		e.setErrorMessage(row.get("ERROR_MESSAGE", String.class));
		e.setCreatedAt(row.get("CREATED_AT", LocalDateTime.class));
		e.setUpdatedAt(row.get("UPDATED_AT", LocalDateTime.class));
		return e;
	}

	private RunRecord toModel(ProgramRecordEntity e) {
		return new RunRecord(e.getProgramName(), toInstant(e.getLastSuccessfulTime()), toInstant(e.getLastRunTime()),
				parseStatus(e.getStatus()), e.getRecordsProcessed() == null ? 0 : e.getRecordsProcessed(),
				e.getTotalRecordsProcessed() == null ? 0 : e.getTotalRecordsProcessed(), e.getErrorMessage(),
				toInstant(e.getCreatedAt()), toInstant(e.getUpdatedAt()));
	}

	private static RunStatus parseStatus(String status) {
		if (status == null || status.isBlank()) {
			return RunStatus.INITIALIZED;
		}
		return RunStatus.valueOf(status.trim().toUpperCase());
	}

	private Instant toInstant(LocalDateTime v) {
		return v == null ? null : v.atZone(zone).toInstant();
	}

	private LocalDateTime now() {
		return LocalDateTime.ofInstant(clock.instant(), zone);
	}

	private static Long asLong(Object v) {
		if (v == null)
			return null;
		if (v instanceof Number n)
			return n.longValue();
		return Long.valueOf(String.valueOf(v));
	}

	static String truncate(String error) {
		if (error == null || error.length() <= MAX_ERROR_LENGTH)
			return error;
		return error.substring(0, MAX_ERROR_LENGTH);
	}
}
