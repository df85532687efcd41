package com.rms.relay.jetstream.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.rms.relay.core.error.ConnectTimeoutException;
import com.rms.relay.core.error.ConnectionUnavailableException;
import com.rms.relay.core.retry.BackoffPolicy;
import com.rms.relay.core.retry.RetryExecutor;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.Options;

@ExtendWith(MockitoExtension.class)
class NatsConnectionHandleTest {

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(2);

    @Mock
    Connection connection;
    @Mock
    JetStream jetStream;
    @Mock
    JetStreamManagement management;

    private final Options options = new Options.Builder().server("nats://localhost:4222").build();
    private final List<Duration> sleeps = new ArrayList<>();
    private final AtomicInteger connectCalls = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        lenient().when(connection.jetStream()).thenReturn(jetStream);
        lenient().when(connection.jetStreamManagement()).thenReturn(management);
        lenient().when(connection.getStatus()).thenReturn(Connection.Status.CONNECTED);
        lenient().when(connection.getMaxPayload()).thenReturn(1024L * 1024);
    }

    private NatsConnectionHandle handle(int maxRetries, int failuresBeforeSuccess) {
        RetryExecutor retry = new RetryExecutor("nats-connect", maxRetries,
                new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(1), 2.0),
                t -> t instanceof IOException, sleeps::add);
        return new NatsConnectionHandle(options, retry, CLOSE_TIMEOUT, opts -> {
            if (connectCalls.incrementAndGet() <= failuresBeforeSuccess) {
                throw new IOException("Unable to connect");
            }
            return connection;
        });
    }

    @Test
    @DisplayName("connect retries refused attempts and then exposes the JetStream contexts")
    void connectsAfterRetries() {
        NatsConnectionHandle handle = handle(3, 2);

        handle.connect();

        assertThat(handle.state()).isEqualTo(NatsConnectionHandle.State.CONNECTED);
        assertThat(handle.jetStream()).isSameAs(jetStream);
        assertThat(handle.management()).isSameAs(management);
        assertThat(handle.maxPayload()).isEqualTo(1024L * 1024);
        assertThat(connectCalls).hasValue(3);
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    @DisplayName("connect gives up with ConnectTimeoutException when the budget is spent")
    void connectExhausted() {
        NatsConnectionHandle handle = handle(2, Integer.MAX_VALUE);

        assertThatThrownBy(handle::connect)
                .isInstanceOf(ConnectTimeoutException.class)
                .hasMessageContaining("nats://localhost:4222")
                .hasCauseInstanceOf(IOException.class);

        assertThat(connectCalls).hasValue(3);
        assertThat(handle.state()).isEqualTo(NatsConnectionHandle.State.CLOSED);
    }

    @Test
    @DisplayName("an interrupted connect keeps the thread's interrupt flag")
    void interruptedConnect() {
        RetryExecutor retry = new RetryExecutor("nats-connect", 3,
                new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(1), 2.0),
                t -> t instanceof IOException, sleeps::add);
        NatsConnectionHandle handle = new NatsConnectionHandle(options, retry, CLOSE_TIMEOUT, opts -> {
            connectCalls.incrementAndGet();
            throw new InterruptedException("shutting down");
        });

        try {
            assertThatThrownBy(handle::connect)
                    .isInstanceOf(ConnectTimeoutException.class)
                    .hasMessageContaining("Interrupted")
                    .hasCauseInstanceOf(InterruptedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
        assertThat(connectCalls).hasValue(1);
        assertThat(sleeps).isEmpty();
        assertThat(handle.state()).isEqualTo(NatsConnectionHandle.State.CLOSED);
    }

    @Test
    void jetStreamUnavailableReleasesTheConnection() throws Exception {
        when(connection.jetStream()).thenThrow(new IOException("JetStream not enabled"));
        NatsConnectionHandle handle = handle(0, 0);

        assertThatThrownBy(handle::connect).isInstanceOf(ConnectTimeoutException.class);

        verify(connection).close();
        assertThat(handle.state()).isEqualTo(NatsConnectionHandle.State.CLOSED);
    }

    @Test
    @DisplayName("contexts are refused before connect and while the client is reconnecting")
    void requiresLiveConnection() {
        NatsConnectionHandle handle = handle(0, 0);

        assertThatThrownBy(handle::jetStream).isInstanceOf(ConnectionUnavailableException.class);
        assertThat(handle.maxPayload()).isEqualTo(-1);

        handle.connect();
        when(connection.getStatus()).thenReturn(Connection.Status.RECONNECTING);

        assertThatThrownBy(handle::jetStream)
                .isInstanceOf(ConnectionUnavailableException.class)
                .hasMessageContaining("RECONNECTING");
    }

    @Test
    @DisplayName("close flushes and closes the connection once; later calls are no-ops")
    void closeIsIdempotent() throws Exception {
        NatsConnectionHandle handle = handle(0, 0);
        handle.connect();

        handle.close();
        handle.close();

        verify(connection, times(1)).flush(CLOSE_TIMEOUT);
        verify(connection, times(1)).close();
        assertThat(handle.state()).isEqualTo(NatsConnectionHandle.State.CLOSED);
        assertThatThrownBy(handle::jetStream).isInstanceOf(ConnectionUnavailableException.class);
    }

    @Test
    void closeBeforeConnect() throws Exception {
        NatsConnectionHandle handle = handle(0, 0);

        handle.close();

        assertThatThrownBy(handle::connect).isInstanceOf(IllegalStateException.class);
        assertThat(connectCalls).hasValue(0);
        verify(connection, never()).close();
    }

    @Test
    void connectIsAllowedOnce() {
        NatsConnectionHandle handle = handle(0, 0);
        handle.connect();

        assertThatThrownBy(handle::connect).isInstanceOf(IllegalStateException.class);
    }
}
