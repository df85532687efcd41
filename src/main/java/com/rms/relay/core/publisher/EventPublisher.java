package com.rms.relay.core.publisher;

import java.util.List;

import com.rms.relay.core.model.DispatchEnvelope;
import com.rms.relay.core.model.PublishOutcome;
import com.rms.relay.core.model.PublishResult;

import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * EventPublisher
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Transport-facing contract for sending dispatch envelopes to the bus.
 * The primary implementation targets NATS JetStream.
 *
 * ROLE IN ARCHITECTURE
 * --------------------
 *
 *   [ Source ] → [ Formatter ] → [ EventPublisher ] → [ JetStream ]
 *                                       │
 *                                       ▼
 *                             outcomes → [ DispatchCycle ] → [ Tracker ]
 *
 * It knows NOTHING about watermarks, batches across a cycle, or the
 * tracking store. It reports what happened to each envelope; the
 * dispatch cycle decides what that means for the watermark.
 *
 * FAILURE SEMANTICS
 * -----------------
 * Per-envelope failures are values, not errors: the returned Monos
 * complete with a {@link PublishOutcome} for every envelope, including
 * FAILED and ABANDONED ones. A Mono error means a bug, not a bus failure.
 *
 * IDENTITY & DEDUPLICATION
 * ------------------------
 * Implementations MUST use the event id as the transport message id so
 * redelivery after a partial cycle is de-duplicated by the server.
 *
 * THREAD SAFETY
 * -------------
 * Implementations are singletons owned by the dispatch cycle; concurrent
 * sends within one batch must be supported.
 */
public interface EventPublisher extends AutoCloseable {

    /**
     * Serializes, sends with retry and awaits the ack for one envelope.
     */
    Mono<PublishOutcome> publishOne(DispatchEnvelope envelope);

    /**
     * Publishes a batch concurrently.
     *
     * CONTRACT
     * --------
     * - Every envelope is serialized before anything is sent. If any fails,
     *   nothing in the batch is sent: the offending envelopes are FAILED with
     *   the serialization reason, the rest FAILED as not sent.
     * - Otherwise all sends are issued together, each with its own retry
     *   budget; one envelope's failure never cancels another's attempts.
     * - Completes when every envelope has a terminal outcome.
     *
     * @return one result per input envelope, in input order
     */
    Mono<List<PublishResult>> publishBatch(List<DispatchEnvelope> envelopes);

    /**
     * Waits for outstanding acks, then releases the connection. Idempotent; never throws.
     */
    @Override
    void close();
}
