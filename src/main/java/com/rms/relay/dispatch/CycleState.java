package com.rms.relay.dispatch;

/**
 * Phase of the dispatch cycle currently running.
 *
 * <pre>
 * IDLE → FETCHING → PUBLISHING → RECONCILING → ADVANCING | REPORTING_PARTIAL → IDLE
 * </pre>
 * A fetch failure or an empty fetch goes straight back to IDLE after the run record is written.
 */
public enum CycleState {
    IDLE,
    FETCHING,
    PUBLISHING,
    RECONCILING,
    ADVANCING,
    REPORTING_PARTIAL
}
