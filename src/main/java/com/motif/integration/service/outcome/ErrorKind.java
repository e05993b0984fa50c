package com.motif.integration.service.outcome;

/**
 * Classification of a failed stage.
 */
public enum ErrorKind {

    /**
     * Malformed request, rejected before any downstream call.
     */
    VALIDATION,

    /**
     * A downstream call exceeded its configured timeout.
     */
    TIMEOUT,

    /**
     * Downstream answered with a non-success status or could not be reached.
     */
    REMOTE_ERROR,

    /**
     * Downstream answered with a success status but an unusable payload.
     */
    INVALID_RESPONSE,

    /**
     * A readiness check did not report completion.
     */
    NOT_READY,

    /**
     * Local fault inside this service (scratch file I/O, an operation that threw).
     */
    INTERNAL;

    /**
     * Remote and invalid-response failures are reported the same way when
     * branch errors are folded together.
     */
    public ErrorKind forAggregation() {
        return this == INVALID_RESPONSE ? REMOTE_ERROR : this;
    }
}
