package com.motif.integration.service.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * State and result of one pipeline execution.
 *
 * Created and mutated only by the {@link PipelineCoordinator} during a single
 * {@code runPipeline} call; not persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineRun {

    private String runId;
    private String tenantId;
    private String sessionId;

    /**
     * Builder job of the primary (NetworkX) artifact.
     */
    private String stage1JobId;

    /**
     * Builder job of the graph-database artifact, absent if that branch failed.
     */
    private String stage2JobId;

    private String primaryArtifactLocation;

    @Builder.Default
    private PipelineStatus status = PipelineStatus.CREATED;

    @Builder.Default
    private List<JsonNode> motifs = new ArrayList<>();

    private JsonNode statistics;

    private boolean stage2Ready;

    private PipelineError error;

    @Builder.Default
    private List<PipelineError> branchErrors = new ArrayList<>();
}
