package com.rms.relay.config;

import java.time.Duration;
import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

/**
 * Application-level configuration for the relay.
 *
 * <h2>Binding</h2>
 * Bound from the {@code relay} prefix; environment variables override YAML through relaxed binding
 * ({@code RELAY_DISPATCHER_BATCH_SIZE=500}).
 * <pre>
 * relay:
 *   dispatcher:
 *     program-name: M_INTIMECASEAGENT
 *     poll-interval: 60s
 *     batch-size: 100
 *     max-records-per-run: 10000
 *   publisher:
 *     subject: txlog.events
 *     data-type: TXLOG
 *     retry: { max-retries: 3, initial-backoff: 1s, max-backoff: 30s, backoff-multiplier: 2.0 }
 *   source:
 *     url: r2dbc:oracle://db:1521/ORCL
 *     table: spc.TXLOG_EVENTS
 *   tracking:
 *     url: r2dbc:mariadb://db:3306/intime
 *     table: ETL_PRMREC
 * </pre>
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>Validation runs at startup; a bad value fails the context rather than the first cycle.</li>
 *   <li>Database passwords should come from the environment or a secrets manager.</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    @Valid
    private Dispatcher dispatcher = new Dispatcher();

    @Valid
    private Publisher publisher = new Publisher();

    @Valid
    private Database source = new Database("spc.TXLOG_EVENTS");

    @Valid
    private Database tracking = new Database("ETL_PRMREC");

    public Dispatcher getDispatcher() { return dispatcher; }
    public void setDispatcher(Dispatcher dispatcher) { this.dispatcher = dispatcher; }

    public Publisher getPublisher() { return publisher; }
    public void setPublisher(Publisher publisher) { this.publisher = publisher; }

    public Database getSource() { return source; }
    public void setSource(Database source) { this.source = source; }

    public Database getTracking() { return tracking; }
    public void setTracking(Database tracking) { this.tracking = tracking; }

    /**
     * Dispatch loop settings.
     */
    public static class Dispatcher {

        /** Enable/disable the polling loop (the status endpoint stays up). */
        private boolean enabled = true;

        /** Key of the tracking row; one watermark per program name. */
        @NotBlank
        private String programName = "M_INTIMECASEAGENT";

        /** Wait after a successful or empty cycle. */
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(60);

        /** Shorter wait after a failed or partial cycle. */
        @NotNull
        private Duration errorPause = Duration.ofSeconds(5);

        /** Envelopes per concurrently published batch; also the reconciliation unit. */
        @Positive
        private int batchSize = 100;

        /** Cap on records fetched per cycle; bounds memory after a long outage. */
        @Positive
        private int maxRecordsPerRun = 10_000;

        /** How long shutdown waits for the in-flight cycle. */
        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getProgramName() { return programName; }
        public void setProgramName(String programName) { this.programName = programName; }

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

        public Duration getErrorPause() { return errorPause; }
        public void setErrorPause(Duration errorPause) { this.errorPause = errorPause; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public int getMaxRecordsPerRun() { return maxRecordsPerRun; }
        public void setMaxRecordsPerRun(int maxRecordsPerRun) { this.maxRecordsPerRun = maxRecordsPerRun; }

        public Duration getShutdownTimeout() { return shutdownTimeout; }
        public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }
    }

    /**
     * Bus publisher settings.
     */
    public static class Publisher {

        /** Subject every envelope is published to; must be covered by the stream's subjects. */
        @NotBlank
        private String subject = "txlog.events";

        /** Value of the envelope's data_type field. */
        @NotBlank
        private String dataType = "TXLOG";

        /** Max wait for a JetStream ack per attempt; a timeout is retried. */
        @NotNull
        private Duration ackTimeout = Duration.ofSeconds(5);

        /** Max wait on close for outstanding acks and the connection flush. */
        @NotNull
        private Duration drainTimeout = Duration.ofSeconds(10);

        /** Upper bound for a serialized envelope; the server's own limit applies when lower. */
        @Positive
        private int maxPayloadBytes = 1024 * 1024;

        @Valid
        private RetryProperties retry = new RetryProperties();

        public String getSubject() { return subject; }
        public void setSubject(String subject) { this.subject = subject; }

        public String getDataType() { return dataType; }
        public void setDataType(String dataType) { this.dataType = dataType; }

        public Duration getAckTimeout() { return ackTimeout; }
        public void setAckTimeout(Duration ackTimeout) { this.ackTimeout = ackTimeout; }

        public Duration getDrainTimeout() { return drainTimeout; }
        public void setDrainTimeout(Duration drainTimeout) { this.drainTimeout = drainTimeout; }

        public int getMaxPayloadBytes() { return maxPayloadBytes; }
        public void setMaxPayloadBytes(int maxPayloadBytes) { this.maxPayloadBytes = maxPayloadBytes; }

        public RetryProperties getRetry() { return retry; }
        public void setRetry(RetryProperties retry) { this.retry = retry; }
    }

    /**
     * Connection and table settings for one database (source or tracking store).
     */
    public static class Database {

        /** R2DBC URL, e.g. {@code r2dbc:postgresql://localhost:5432/intime}. */
        @NotBlank
        private String url;

        private String username;

        private String password;

        /** Table name, optionally schema-qualified. Interpolated into SQL, hence the strict pattern. */
        @NotBlank
        @Pattern(regexp = "[A-Za-z0-9_.]+")
        private String table;

        /** Zone the database's zone-less TIMESTAMP columns are written in. */
        @NotNull
        private ZoneId zoneId = ZoneId.of("UTC");

        /** Upper bound of pooled connections. */
        @Positive
        private int poolMaxSize = 5;

        @Valid
        private RetryProperties retry = new RetryProperties();

        public Database() {
        }

        public Database(String table) {
            this.table = table;
        }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public String getTable() { return table; }
        public void setTable(String table) { this.table = table; }

        public ZoneId getZoneId() { return zoneId; }
        public void setZoneId(ZoneId zoneId) { this.zoneId = zoneId; }

        public int getPoolMaxSize() { return poolMaxSize; }
        public void setPoolMaxSize(int poolMaxSize) { this.poolMaxSize = poolMaxSize; }

        public RetryProperties getRetry() { return retry; }
        public void setRetry(RetryProperties retry) { this.retry = retry; }
    }
}
