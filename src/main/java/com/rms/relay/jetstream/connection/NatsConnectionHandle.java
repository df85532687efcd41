package com.rms.relay.jetstream.connection;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rms.relay.core.error.ConnectTimeoutException;
import com.rms.relay.core.error.ConnectionUnavailableException;
import com.rms.relay.core.retry.RetryExecutor;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.Nats;
import io.nats.client.Options;

/**
 * Explicitly owned handle around the single NATS {@link Connection} of the process.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   NEW ──connect()──▶ CONNECTING ──▶ CONNECTED ──close()──▶ CLOSED
 *    │                     │
 *    └──close()──▶ CLOSED  └──close()──▶ CLOSED (late connection is released on arrival)
 * </pre>
 *
 * <h2>Ownership</h2>
 * Only the bus publisher sends through this handle; the stream bootstrapper uses the management
 * API once at startup. Nobody else closes or replaces the connection.
 *
 * <h2>Connect</h2>
 * The initial connect is blocking and retried with the configured backoff on {@link IOException}.
 * When the budget is spent a {@link ConnectTimeoutException} is thrown, which fails bean creation
 * and therefore startup.
 *
 * <h2>Close</h2>
 * Idempotent and null-safe: a no-op when never connected, and a best-effort abandon while a
 * connect is still in progress. Flushes pending writes (bounded) before closing. Never throws.
 */
public class NatsConnectionHandle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NatsConnectionHandle.class);

    /** Opens a connection; {@code Nats::connect} outside of tests. */
    @FunctionalInterface
    public interface Connector {
        Connection connect(Options options) throws IOException, InterruptedException;
    }

    public enum State { NEW, CONNECTING, CONNECTED, CLOSED }

    private final Options options;
    private final RetryExecutor connectRetry;
    private final Connector connector;
    private final Duration closeTimeout;

    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);

    private volatile Connection connection;
    private volatile JetStream jetStream;
    private volatile JetStreamManagement management;

    public NatsConnectionHandle(Options options, RetryExecutor connectRetry, Duration closeTimeout) {
        this(options, connectRetry, closeTimeout, Nats::connect);
    }

    public NatsConnectionHandle(Options options, RetryExecutor connectRetry, Duration closeTimeout,
            Connector connector) {
        this.options = Objects.requireNonNull(options, "options");
        this.connectRetry = Objects.requireNonNull(connectRetry, "connectRetry");
        this.closeTimeout = Objects.requireNonNull(closeTimeout, "closeTimeout");
        this.connector = Objects.requireNonNull(connector, "connector");
    }

    /**
     * Establishes the connection and the JetStream contexts.
     *
     * @throws ConnectTimeoutException when no connection could be made within the retry budget
     */
    public void connect() {
        if (!state.compareAndSet(State.NEW, State.CONNECTING)) {
            throw new IllegalStateException("connect() is allowed once; state=" + state.get());
        }

        Connection c;
        try {
            c = connectRetry.execute(() -> {
                if (state.get() == State.CLOSED) {
                    throw new ConnectionUnavailableException("Handle closed while connecting");
                }
                return connector.connect(options);
            });
        } catch (ConnectionUnavailableException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state.compareAndSet(State.CONNECTING, State.CLOSED);
            throw new ConnectTimeoutException("Interrupted while connecting to NATS at " + options.getServers(), e);
        } catch (Exception e) {
            state.compareAndSet(State.CONNECTING, State.CLOSED);
            throw new ConnectTimeoutException("Could not connect to NATS at " + options.getServers(), e);
        }

        try {
            this.jetStream = c.jetStream();
            this.management = c.jetStreamManagement();
        } catch (IOException e) {
            release(c);
            state.compareAndSet(State.CONNECTING, State.CLOSED);
            throw new ConnectTimeoutException("JetStream is not available on " + options.getServers(), e);
        }
        this.connection = c;

        if (!state.compareAndSet(State.CONNECTING, State.CONNECTED)) {
            log.warn("NATS handle closed while connecting; releasing the late connection");
            clear();
            release(c);
            throw new ConnectionUnavailableException("Handle closed while connecting");
        }
        log.info("Connected to NATS (servers={}, maxPayload={})", options.getServers(), c.getMaxPayload());
    }

    /**
     * JetStream publish context.
     *
     * @throws ConnectionUnavailableException unless connected right now
     */
    public JetStream jetStream() {
        requireConnected();
        return jetStream;
    }

    /**
     * JetStream management context (streams/consumers).
     *
     * @throws ConnectionUnavailableException unless connected right now
     */
    public JetStreamManagement management() {
        requireConnected();
        return management;
    }

    /** Server-announced max payload in bytes, or -1 when not connected. */
    public long maxPayload() {
        Connection c = connection;
        return c == null ? -1 : c.getMaxPayload();
    }

    public State state() {
        return state.get();
    }

    @Override
    public void close() {
        State previous = state.getAndSet(State.CLOSED);
        switch (previous) {
            case CLOSED -> log.debug("NATS handle already closed");
            case NEW -> log.debug("NATS handle closed before connect; nothing to release");
            case CONNECTING -> log.info("NATS handle closed while connecting; connection will be abandoned");
            case CONNECTED -> {
                Connection c = connection;
                clear();
                release(c);
                log.info("NATS connection closed");
            }
        }
    }

    private void requireConnected() {
        Connection c = connection;
        if (state.get() != State.CONNECTED || c == null) {
            throw new ConnectionUnavailableException("NATS connection not established (state=" + state.get() + ")");
        }
        Connection.Status status = c.getStatus();
        if (status != Connection.Status.CONNECTED) {
            throw new ConnectionUnavailableException("NATS connection is " + status);
        }
    }

    private void clear() {
        this.connection = null;
        this.jetStream = null;
        this.management = null;
    }

    private void release(Connection c) {
        if (c == null) {
            return;
        }
        try {
            c.flush(closeTimeout);
        } catch (TimeoutException e) {
            log.warn("NATS flush did not complete within {}", closeTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while flushing NATS connection");
        } catch (IllegalStateException e) {
            log.debug("NATS connection already closed before flush: {}", e.getMessage());
        }
        try {
            c.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing NATS connection");
        }
    }
}
