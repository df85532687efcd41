package com.rms.relay.dispatch;

public enum CycleStatus {
    /** Every fetched record was published; the watermark moved to the last one. */
    SUCCESS,
    /** Nothing newer than the watermark. */
    EMPTY,
    /** Some batches were published before one failed. */
    PARTIAL,
    /** Nothing was published. */
    FAILED
}
