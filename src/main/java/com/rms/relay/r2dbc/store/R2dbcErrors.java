package com.rms.relay.r2dbc.store;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;

import io.r2dbc.spi.R2dbcNonTransientResourceException;
import io.r2dbc.spi.R2dbcTransientException;

/**
 * Retry classification shared by the R2DBC stores.
 */
final class R2dbcErrors {

    private R2dbcErrors() {
    }

    /**
     * Connection loss, pool exhaustion, deadlocks and timeouts are worth another attempt; SQL
     * grammar, constraint and mapping errors are not.
     */
    static boolean isTransient(Throwable t) {
        return t instanceof TransientDataAccessException
                || t instanceof DataAccessResourceFailureException
                || t instanceof R2dbcTransientException
                || t instanceof R2dbcNonTransientResourceException;
    }
}
