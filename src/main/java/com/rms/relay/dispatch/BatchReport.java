package com.rms.relay.dispatch;

import java.time.Instant;
import java.util.List;

import com.rms.relay.core.model.PublishResult;

/**
 * Outcomes of one published batch, in input order.
 *
 * @param index   zero-based position of the batch in the cycle
 * @param results one result per envelope
 */
public record BatchReport(int index, List<PublishResult> results) {

    public BatchReport {
        if (results == null || results.isEmpty()) {
            throw new IllegalArgumentException("A batch report needs at least one result");
        }
        results = List.copyOf(results);
    }

    /** True only when every envelope of the batch was acknowledged. */
    public boolean succeeded() {
        return results.stream().allMatch(PublishResult::isSucceeded);
    }

    /** Timestamp of the batch's first record; a failed batch holds the watermark below it. */
    public Instant firstTimestamp() {
        return results.get(0).envelope().record().timestamp();
    }

    public List<PublishResult> failures() {
        return results.stream().filter(r -> !r.isSucceeded()).toList();
    }

    public int size() {
        return results.size();
    }
}
