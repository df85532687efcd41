package com.rms.relay.core.model;

/**
 * Pairs an envelope with its outcome. {@code index} is the envelope's position in the batch as
 * submitted, so results can be re-ordered independently of completion order.
 */
public record PublishResult(int index, DispatchEnvelope envelope, PublishOutcome outcome) {

    public boolean isSucceeded() {
        return outcome.isSucceeded();
    }
}
