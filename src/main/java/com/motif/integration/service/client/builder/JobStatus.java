package com.motif.integration.service.client.builder;

import com.motif.integration.service.mining.GraphKind;

import java.util.Optional;

/**
 * Status of a builder job as reported by its status endpoint.
 *
 * @param jobId     the job
 * @param status    reported status, e.g. "processing" or "completed"
 * @param graphType artifact graph type from the job metadata, may be null
 */
public record JobStatus(String jobId, String status, String graphType) {

    public static final String COMPLETED = "completed";

    public boolean isCompleted() {
        return COMPLETED.equals(status);
    }

    /**
     * Graph kind of the job's artifact, empty when the metadata is missing or unrecognized.
     */
    public Optional<GraphKind> graphKind() {
        if (graphType == null || graphType.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(GraphKind.fromWire(graphType.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
