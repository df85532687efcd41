package com.rms.relay.jetstream.publisher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.rms.relay.config.JacksonConfig;
import com.rms.relay.config.RelayProperties;
import com.rms.relay.core.error.ConnectionUnavailableException;
import com.rms.relay.core.model.DispatchEnvelope;
import com.rms.relay.core.model.OutcomeStatus;
import com.rms.relay.core.model.PublishResult;
import com.rms.relay.jetstream.connection.NatsConnectionHandle;
import com.rms.relay.support.Events;

import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.PublishOptions;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class JetStreamEventPublisherTest {

    private static final String SUBJECT = "txlog.events";

    @Mock
    NatsConnectionHandle handle;
    @Mock
    JetStream js;

    private RelayProperties.Publisher props;
    private JetStreamEventPublisher publisher;

    @BeforeEach
    void setUp() {
        props = new RelayProperties.Publisher();
        props.setSubject(SUBJECT);
        props.getRetry().setMaxRetries(3);
        props.getRetry().setInitialBackoff(Duration.ofSeconds(1));
        props.getRetry().setMaxBackoff(Duration.ofSeconds(30));
        props.getRetry().setBackoffMultiplier(2.0);

        lenient().when(handle.jetStream()).thenReturn(js);
        lenient().when(handle.maxPayload()).thenReturn(1024L * 1024);

        publisher = newPublisher();
    }

    private JetStreamEventPublisher newPublisher() {
        return new JetStreamEventPublisher(handle,
                new EnvelopeSerializer(JacksonConfig.relayObjectMapper(), props.getMaxPayloadBytes()), props);
    }

    private void stubPublish(Function<String, CompletableFuture<PublishAck>> byMessageId) {
        when(js.publishAsync(eq(SUBJECT), any(Headers.class), any(byte[].class), any(PublishOptions.class)))
                .thenAnswer(inv -> byMessageId.apply(inv.<PublishOptions>getArgument(3).getMessageId()));
    }

    private static CompletableFuture<PublishAck> acked(long seq) {
        PublishAck ack = mock(PublishAck.class);
        lenient().when(ack.getSeqno()).thenReturn(seq);
        lenient().when(ack.getStream()).thenReturn("TXLOG_STREAM");
        return CompletableFuture.completedFuture(ack);
    }

    private static CompletableFuture<PublishAck> brokenPipe() {
        return CompletableFuture.failedFuture(new IOException("broken pipe"));
    }

    @Test
    @DisplayName("a malformed envelope fails the whole batch before any traffic")
    void preCheckIsolation() {
        List<DispatchEnvelope> batch = List.of(
                Events.envelope("e1"), Events.envelope("e2"), Events.unserializable("e3"),
                Events.envelope("e4"), Events.envelope("e5"));

        StepVerifier.create(publisher.publishBatch(batch))
                .assertNext(results -> {
                    assertThat(results).hasSize(5);
                    assertThat(results).extracting(PublishResult::index).containsExactly(0, 1, 2, 3, 4);
                    assertThat(results).allSatisfy(r -> {
                        assertThat(r.outcome().status()).isEqualTo(OutcomeStatus.FAILED);
                        assertThat(r.outcome().attempts()).isZero();
                    });
                    assertThat(results.get(2).outcome().reason()).contains("e3").contains("not serializable");
                    assertThat(results).filteredOn(r -> r.index() != 2)
                            .allSatisfy(r -> assertThat(r.outcome().reason())
                                    .isEqualTo(JetStreamEventPublisher.NOT_SENT_REASON));
                })
                .verifyComplete();

        verify(js, never()).publishAsync(anyString(), any(Headers.class), any(byte[].class), any(PublishOptions.class));
    }

    @Test
    @DisplayName("every envelope is sent once with its event id as Msg-Id")
    void allSucceed() {
        AtomicInteger seq = new AtomicInteger();
        stubPublish(id -> acked(seq.incrementAndGet()));
        List<DispatchEnvelope> batch = Events.envelopes(3);

        StepVerifier.create(publisher.publishBatch(batch))
                .assertNext(results -> {
                    assertThat(results).extracting(r -> r.envelope().eventId()).containsExactly("e1", "e2", "e3");
                    assertThat(results).allSatisfy(r -> {
                        assertThat(r.outcome().status()).isEqualTo(OutcomeStatus.SUCCEEDED);
                        assertThat(r.outcome().attempts()).isEqualTo(1);
                        assertThat(r.outcome().sequence()).isPositive();
                    });
                })
                .verifyComplete();

        ArgumentCaptor<PublishOptions> options = ArgumentCaptor.forClass(PublishOptions.class);
        verify(js, times(3)).publishAsync(eq(SUBJECT), any(Headers.class), any(byte[].class), options.capture());
        assertThat(options.getAllValues()).extracting(PublishOptions::getMessageId)
                .containsExactlyInAnyOrder("e1", "e2", "e3");
    }

    @Test
    @DisplayName("one envelope's retries neither block nor cancel its siblings")
    void concurrencyIndependence() {
        Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
        stubPublish(id -> {
            int n = calls.computeIfAbsent(id, k -> new AtomicInteger()).incrementAndGet();
            return switch (id) {
                case "e1" -> brokenPipe();
                case "e2" -> n < 3 ? brokenPipe() : acked(20);
                default -> acked(n);
            };
        });
        List<DispatchEnvelope> batch = Events.envelopes(4);

        StepVerifier.withVirtualTime(() -> publisher.publishEach(batch))
                .expectSubscription()
                // e3 and e4 finish while e1 and e2 are still backing off
                .assertNext(r -> assertThat(r.index()).isEqualTo(2))
                .assertNext(r -> assertThat(r.index()).isEqualTo(3))
                .expectNoEvent(Duration.ofMillis(2999))
                .thenAwait(Duration.ofMillis(1))
                .assertNext(r -> {
                    assertThat(r.index()).isEqualTo(1);
                    assertThat(r.outcome().status()).isEqualTo(OutcomeStatus.SUCCEEDED);
                    assertThat(r.outcome().attempts()).isEqualTo(3);
                })
                .expectNoEvent(Duration.ofMillis(3999))
                .thenAwait(Duration.ofMillis(1))
                .assertNext(r -> {
                    assertThat(r.index()).isZero();
                    assertThat(r.outcome().status()).isEqualTo(OutcomeStatus.ABANDONED);
                    assertThat(r.outcome().attempts()).isEqualTo(4);
                    assertThat(r.outcome().reason()).contains("broken pipe");
                })
                .verifyComplete();

        assertThat(calls.get("e1")).hasValue(4);
        assertThat(calls.get("e3")).hasValue(1);
        assertThat(calls.get("e4")).hasValue(1);
    }

    @Test
    @DisplayName("publishBatch returns input order even when acks arrive out of order")
    void inputOrder() {
        CompletableFuture<PublishAck> slow = new CompletableFuture<>();
        CompletableFuture<PublishAck> fast = acked(2);
        stubPublish(id -> id.equals("e1") ? slow : fast);

        StepVerifier.create(publisher.publishBatch(Events.envelopes(2)))
                .then(() -> slow.complete(acked(1).join()))
                .assertNext(results -> {
                    assertThat(results).extracting(PublishResult::index).containsExactly(0, 1);
                    assertThat(results).extracting(r -> r.outcome().sequence()).containsExactly(1L, 2L);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("JetStream API errors are retried and end ABANDONED")
    void rejectedIsAbandoned() {
        stubPublish(id -> {
            JetStreamApiException rejected = mock(JetStreamApiException.class);
            lenient().when(rejected.getApiErrorCode()).thenReturn(10077);
            lenient().when(rejected.getMessage()).thenReturn("maximum messages exceeded");
            return CompletableFuture.failedFuture(rejected);
        });

        StepVerifier.withVirtualTime(() -> publisher.publishOne(Events.envelope("e1")))
                .thenAwait(Duration.ofMinutes(1))
                .assertNext(outcome -> {
                    assertThat(outcome.status()).isEqualTo(OutcomeStatus.ABANDONED);
                    assertThat(outcome.attempts()).isEqualTo(4);
                    assertThat(outcome.reason()).contains("maximum messages exceeded");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("a missing ack times out and is retried")
    void ackTimeout() {
        stubPublish(id -> new CompletableFuture<>());

        StepVerifier.withVirtualTime(() -> publisher.publishOne(Events.envelope("e1")))
                .thenAwait(Duration.ofMinutes(1))
                .assertNext(outcome -> {
                    assertThat(outcome.status()).isEqualTo(OutcomeStatus.ABANDONED);
                    assertThat(outcome.attempts()).isEqualTo(4);
                    assertThat(outcome.reason()).contains("No ack within");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("non-retryable send errors are FAILED after one attempt")
    void nonRetryableIsFailed() {
        stubPublish(id -> CompletableFuture.failedFuture(new IllegalArgumentException("invalid subject")));

        StepVerifier.create(publisher.publishOne(Events.envelope("e1")))
                .assertNext(outcome -> {
                    assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
                    assertThat(outcome.attempts()).isEqualTo(1);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("an unavailable connection is retried until it comes back")
    void connectionComesBack() {
        when(handle.jetStream())
                .thenThrow(new ConnectionUnavailableException("NATS connection is RECONNECTING"))
                .thenReturn(js);
        stubPublish(id -> acked(7));

        StepVerifier.withVirtualTime(() -> publisher.publishOne(Events.envelope("e1")))
                .thenAwait(Duration.ofSeconds(1))
                .assertNext(outcome -> {
                    assertThat(outcome.status()).isEqualTo(OutcomeStatus.SUCCEEDED);
                    assertThat(outcome.attempts()).isEqualTo(2);
                    assertThat(outcome.sequence()).isEqualTo(7L);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("close waits for outstanding acks up to the drain timeout, closes the handle once")
    void closeDrainsAndIsIdempotent() {
        props.setDrainTimeout(Duration.ofMillis(200));
        JetStreamEventPublisher p = newPublisher();
        stubPublish(id -> new CompletableFuture<>());
        p.publishOne(Events.envelope("e1")).subscribe();

        long started = System.nanoTime();
        p.close();
        p.close();

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isGreaterThanOrEqualTo(Duration.ofMillis(200));
        assertThat(p.isClosed()).isTrue();
        verify(handle, times(1)).close();
    }

    @Test
    @DisplayName("nothing is sent after close")
    void noSendAfterClose() {
        publisher.close();

        StepVerifier.create(publisher.publishOne(Events.envelope("e1")))
                .assertNext(outcome -> {
                    assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
                    assertThat(outcome.attempts()).isZero();
                })
                .verifyComplete();

        verify(js, never()).publishAsync(anyString(), any(Headers.class), any(byte[].class), any(PublishOptions.class));
    }

    @Test
    void emptyBatch() {
        StepVerifier.create(publisher.publishBatch(List.of()))
                .assertNext(results -> assertThat(results).isEmpty())
                .verifyComplete();
    }
}
