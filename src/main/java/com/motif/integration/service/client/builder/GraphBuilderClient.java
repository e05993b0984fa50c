package com.motif.integration.service.client.builder;

import com.motif.integration.service.outcome.StageOutcome;

/**
 * Adapter for the graph-builder service.
 *
 * Implementations never throw; every problem is reported as a failed outcome.
 */
public interface GraphBuilderClient {

    /**
     * Uploads tabular input and asks the builder to generate a graph artifact.
     *
     * @param request the files and writer selection
     * @return the assigned job and artifact location, or a failure
     */
    StageOutcome<BuildResult> generate(BuildRequest request);

    /**
     * Fetches the current status and metadata of a builder job.
     *
     * Uses the short readiness timeout, not the generation timeout.
     *
     * @param jobId the builder job ID
     * @return the reported status, or a failure
     */
    StageOutcome<JobStatus> fetchJobStatus(String jobId);
}
