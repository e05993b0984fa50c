package com.motif.integration.service.readiness;

import com.motif.integration.service.client.builder.GraphBuilderClient;
import com.motif.integration.service.client.builder.JobStatus;
import com.motif.integration.service.outcome.StageOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Readiness prober backed by the graph builder's job status endpoint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BuilderReadinessProber implements ReadinessProber {

    private final GraphBuilderClient graphBuilderClient;

    @Override
    public boolean isReady(String downstreamJobId) {
        if (downstreamJobId == null || downstreamJobId.isBlank()) {
            return false;
        }

        StageOutcome<JobStatus> outcome = graphBuilderClient.fetchJobStatus(downstreamJobId);
        if (outcome instanceof StageOutcome.Failure<JobStatus> failure) {
            log.warn("Readiness check failed for job {}: {} [{}]",
                    downstreamJobId, failure.message(), failure.kind());
            return false;
        }

        boolean ready = outcome.value().map(JobStatus::isCompleted).orElse(false);
        if (!ready) {
            log.info("Job {} not ready: status={}", downstreamJobId,
                    outcome.value().map(JobStatus::status).orElse(null));
        }
        return ready;
    }
}
