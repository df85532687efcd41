package com.rms.relay.core.model;

/**
 * Terminal result of one envelope's publish attempt sequence.
 *
 * <pre>
 *   send ──ack──▶ SUCCEEDED
 *     │
 *     ├─non-retryable error / batch pre-check failed──▶ FAILED
 *     │
 *     └─retryable error, budget exhausted──▶ ABANDONED
 * </pre>
 */
public enum OutcomeStatus {

    /** JetStream acknowledged the message (a duplicate ack counts as success). */
    SUCCEEDED,

    /** Not retried: malformed envelope, or the envelope was held back because its batch failed pre-check. */
    FAILED,

    /** A retryable failure persisted through every retry. */
    ABANDONED
}
