package com.rms.relay.core.model;

import java.util.Objects;

/**
 * Per-envelope publish result.
 *
 * @param status   terminal status
 * @param reason   failure reason; {@code null} for {@link OutcomeStatus#SUCCEEDED}
 * @param attempts number of sends made (0 when nothing was sent)
 * @param sequence JetStream stream sequence of the ack; -1 unless succeeded
 */
public record PublishOutcome(OutcomeStatus status, String reason, int attempts, long sequence) {

    public PublishOutcome {
        Objects.requireNonNull(status, "status");
    }

    public static PublishOutcome succeeded(int attempts, long sequence) {
        return new PublishOutcome(OutcomeStatus.SUCCEEDED, null, attempts, sequence);
    }

    public static PublishOutcome failed(String reason, int attempts) {
        return new PublishOutcome(OutcomeStatus.FAILED, reason, attempts, -1);
    }

    public static PublishOutcome abandoned(String reason, int attempts) {
        return new PublishOutcome(OutcomeStatus.ABANDONED, reason, attempts, -1);
    }

    public boolean isSucceeded() {
        return status == OutcomeStatus.SUCCEEDED;
    }
}
