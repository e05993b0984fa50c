package com.motif.integration.service.readiness;

/**
 * Single-shot readiness check of a downstream job.
 */
public interface ReadinessProber {

    /**
     * Checks once whether a downstream job reports completion.
     *
     * Does not wait or retry. "Still running" and "will never finish" both
     * read as {@code false}; callers that need to wait must call again.
     *
     * @param downstreamJobId the job to check
     * @return true only if the job reports it is completed
     */
    boolean isReady(String downstreamJobId);
}
