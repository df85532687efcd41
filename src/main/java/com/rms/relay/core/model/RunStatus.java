package com.rms.relay.core.model;

/**
 * Status column of the program tracking row.
 */
public enum RunStatus {

    /** Row created at startup; no cycle has completed yet. */
    INITIALIZED,

    SUCCESS,

    FAILED
}
