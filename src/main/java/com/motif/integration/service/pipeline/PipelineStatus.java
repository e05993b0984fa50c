package com.motif.integration.service.pipeline;

/**
 * Lifecycle of one pipeline run.
 *
 * CREATED → PRIMARY_GENERATING → BRANCHING → one of the terminal states.
 * A primary generation failure jumps straight to TOTAL_FAILURE.
 */
public enum PipelineStatus {
    CREATED,
    PRIMARY_GENERATING,

    /**
     * Secondary graph generation and mining in flight.
     */
    BRANCHING,

    SUCCESS,
    PARTIAL_FAILURE,
    TOTAL_FAILURE
}
