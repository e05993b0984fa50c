package com.motif.integration.service.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Result of mining a previously generated artifact.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MiningRunResult(
        String artifactId,
        PipelineStatus status,
        List<JsonNode> motifs,
        JsonNode statistics,
        PipelineError error
) {

    static MiningRunResult success(String artifactId, List<JsonNode> motifs, JsonNode statistics) {
        return new MiningRunResult(artifactId, PipelineStatus.SUCCESS, motifs, statistics, null);
    }

    static MiningRunResult failure(String artifactId, PipelineError error) {
        return new MiningRunResult(artifactId, PipelineStatus.TOTAL_FAILURE, List.of(), null, error);
    }
}
