package com.motif.integration.service.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for motif annotation requests.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnnotateRequest {

    /**
     * Pipeline run the motif was mined in.
     */
    @JsonProperty("job_id")
    private String jobId;

    /**
     * Graph-database job the motif is annotated against.
     */
    @NotBlank(message = "neo4j_job_id is required")
    @JsonProperty("neo4j_job_id")
    private String neo4jJobId;

    /**
     * The motif as returned by the miner.
     */
    @NotNull(message = "selected_motif is required")
    @JsonProperty("selected_motif")
    private JsonNode selectedMotif;
}
