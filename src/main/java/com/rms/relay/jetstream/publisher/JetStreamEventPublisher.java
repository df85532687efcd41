package com.rms.relay.jetstream.publisher;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rms.relay.config.RelayProperties;
import com.rms.relay.core.error.ConnectionUnavailableException;
import com.rms.relay.core.error.MalformedEventException;
import com.rms.relay.core.error.RelayException;
import com.rms.relay.core.error.SendRejectedException;
import com.rms.relay.core.model.DispatchEnvelope;
import com.rms.relay.core.model.PublishOutcome;
import com.rms.relay.core.model.PublishResult;
import com.rms.relay.core.publisher.EventPublisher;
import com.rms.relay.core.retry.RetryExecutor;
import com.rms.relay.core.retry.RetryExhaustedException;
import com.rms.relay.jetstream.connection.NatsConnectionHandle;

import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.PublishOptions;
import io.nats.client.api.PublishAck;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive JetStream implementation of {@link EventPublisher}.
 *
 * <h2>De-duplication rule</h2>
 * <ul>
 *   <li>{@code Msg-Id == event id}</li>
 *   <li>Retries and redelivery after a partial cycle reuse the id, so the server drops duplicates
 *   inside its duplicate window.</li>
 * </ul>
 *
 * <h2>Sending</h2>
 * Sends use {@link JetStream#publishAsync} and never block a thread: the ack is awaited as a
 * {@link Mono} with a per-attempt timeout, and the backoff between attempts is a {@code Mono.delay}.
 * A slow or retrying envelope only delays its own outcome.
 *
 * <h2>Error mapping</h2>
 * <ul>
 *   <li>I/O errors, ack timeouts, a closed or reconnecting connection → {@link ConnectionUnavailableException}</li>
 *   <li>JetStream API errors → {@link SendRejectedException}</li>
 *   <li>Both are retried; when the budget is spent the outcome is ABANDONED.</li>
 *   <li>Anything else, and any failure after {@link #close()}, is FAILED without further attempts.</li>
 * </ul>
 *
 * <h2>Shutdown</h2>
 * {@link #close()} stops new sends, waits up to the drain timeout for outstanding acks, then
 * closes the connection handle.
 */
public class JetStreamEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(JetStreamEventPublisher.class);

    static final String NOT_SENT_REASON = "not sent: batch rejected at pre-check";

    private final NatsConnectionHandle handle;
    private final EnvelopeSerializer serializer;
    private final String subject;
    private final Duration ackTimeout;
    private final Duration drainTimeout;
    private final RetryExecutor sendRetry;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Set<CompletableFuture<PublishAck>> inFlight = ConcurrentHashMap.newKeySet();

    public JetStreamEventPublisher(NatsConnectionHandle handle, EnvelopeSerializer serializer,
            RelayProperties.Publisher props) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.subject = props.getSubject();
        this.ackTimeout = props.getAckTimeout();
        this.drainTimeout = props.getDrainTimeout();
        this.sendRetry = props.getRetry().toExecutor("publish",
                t -> !closed.get() && RelayException.isRetryable(t));
    }

    @Override
    public Mono<PublishOutcome> publishOne(DispatchEnvelope envelope) {
        return Mono.defer(() -> {
            byte[] body;
            try {
                body = serializer.serialize(envelope, handle.maxPayload());
            } catch (MalformedEventException e) {
                log.warn("Rejected event {}: {}", envelope.eventId(), e.getMessage());
                return Mono.just(PublishOutcome.failed(e.getMessage(), 0));
            }
            return send(envelope, body);
        });
    }

    @Override
    public Mono<List<PublishResult>> publishBatch(List<DispatchEnvelope> envelopes) {
        return publishEach(envelopes)
                .collectSortedList(Comparator.comparingInt(PublishResult::index))
                .doOnNext(results -> logBatch(envelopes.size(), results));
    }

    /**
     * Same contract as {@link #publishBatch}, but emits each result as soon as its envelope
     * reaches a terminal outcome (completion order, not input order).
     */
    public Flux<PublishResult> publishEach(List<DispatchEnvelope> envelopes) {
        return Flux.defer(() -> {
            if (envelopes.isEmpty()) {
                return Flux.empty();
            }

            long serverMax = handle.maxPayload();
            List<byte[]> bodies = new ArrayList<>(envelopes.size());
            Map<Integer, String> malformed = new LinkedHashMap<>();
            for (int i = 0; i < envelopes.size(); i++) {
                try {
                    bodies.add(serializer.serialize(envelopes.get(i), serverMax));
                } catch (MalformedEventException e) {
                    bodies.add(null);
                    malformed.put(i, e.getMessage());
                }
            }

            if (!malformed.isEmpty()) {
                log.warn("Batch of {} rejected before sending; malformed events: {}", envelopes.size(), malformed);
                List<PublishResult> rejected = new ArrayList<>(envelopes.size());
                for (int i = 0; i < envelopes.size(); i++) {
                    String reason = malformed.getOrDefault(i, NOT_SENT_REASON);
                    rejected.add(new PublishResult(i, envelopes.get(i), PublishOutcome.failed(reason, 0)));
                }
                return Flux.fromIterable(rejected);
            }

            return Flux.range(0, envelopes.size())
                    .flatMap(i -> send(envelopes.get(i), bodies.get(i))
                            .map(outcome -> new PublishResult(i, envelopes.get(i), outcome)),
                            envelopes.size());
        });
    }

    /**
     * Sends one pre-serialized envelope with retry. Never errors: failures become outcomes.
     */
    private Mono<PublishOutcome> send(DispatchEnvelope envelope, byte[] body) {
        AtomicInteger attempts = new AtomicInteger();
        Mono<PublishAck> attempt = Mono.defer(() -> {
            if (closed.get()) {
                return Mono.error(new ConnectionUnavailableException("Publisher is closed"));
            }
            attempts.incrementAndGet();
            return sendOnce(envelope, body);
        });

        return sendRetry.apply(attempt)
                .map(ack -> {
                    log.debug("Published event id={} stream={} seq={} duplicate={}",
                            envelope.eventId(), ack.getStream(), ack.getSeqno(), ack.isDuplicate());
                    return PublishOutcome.succeeded(attempts.get(), ack.getSeqno());
                })
                .onErrorResume(e -> Mono.just(toOutcome(envelope, e, attempts.get())));
    }

    private Mono<PublishAck> sendOnce(DispatchEnvelope envelope, byte[] body) {
        CompletableFuture<PublishAck> future;
        try {
            JetStream js = handle.jetStream();
            PublishOptions opts = PublishOptions.builder()
                    .messageId(envelope.eventId())
                    .build();
            future = js.publishAsync(subject, serializer.headers(envelope), body, opts);
        } catch (RuntimeException e) {
            return Mono.error(mapSendError(e));
        }

        inFlight.add(future);
        future.whenComplete((ack, t) -> inFlight.remove(future));

        return Mono.fromFuture(future)
                .timeout(ackTimeout)
                .onErrorMap(this::mapSendError);
    }

    private Throwable mapSendError(Throwable t) {
        Throwable e = unwrap(t);
        if (e instanceof RelayException) {
            return e;
        }
        if (e instanceof JetStreamApiException api) {
            return new SendRejectedException("JetStream rejected publish: " + api.getMessage(), api.getApiErrorCode(), api);
        }
        if (e instanceof TimeoutException) {
            return new ConnectionUnavailableException("No ack within " + ackTimeout, e);
        }
        if (e instanceof IOException || e instanceof IllegalStateException || e instanceof CancellationException) {
            return new ConnectionUnavailableException("Publish failed: " + e.getMessage(), e);
        }
        return e;
    }

    private static Throwable unwrap(Throwable t) {
        Throwable e = t;
        while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }

    private PublishOutcome toOutcome(DispatchEnvelope envelope, Throwable e, int attempts) {
        String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        if (RetryExhaustedException.attemptsOf(e).isPresent()) {
            log.warn("Abandoned event {} after {} attempt(s): {}", envelope.eventId(), attempts, reason);
            return PublishOutcome.abandoned(reason, attempts);
        }
        log.warn("Failed event {} after {} attempt(s): {}", envelope.eventId(), attempts, reason);
        return PublishOutcome.failed(reason, attempts);
    }

    private static void logBatch(int size, List<PublishResult> results) {
        long ok = results.stream().filter(PublishResult::isSucceeded).count();
        if (ok == size) {
            log.info("Published batch of {} event(s)", size);
        } else {
            log.warn("Batch of {} event(s): {} succeeded, {} not published", size, ok, size - ok);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        int pending = inFlight.size();
        if (pending > 0) {
            log.info("Waiting up to {} for {} outstanding ack(s)", drainTimeout, pending);
            CompletableFuture<Void> all = CompletableFuture.allOf(inFlight.toArray(CompletableFuture[]::new));
            try {
                all.get(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("{} ack(s) still outstanding after {}", inFlight.size(), drainTimeout);
            } catch (ExecutionException e) {
                // Already reported through that envelope's own outcome.
                log.debug("Outstanding publish failed during drain: {}", e.getCause().toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while draining outstanding acks");
            }
        }

        handle.close();
    }

    public boolean isClosed() {
        return closed.get();
    }
}
