package com.motif.integration.service.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for mining a previously generated graph artifact.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MineRequest {

    @NotBlank(message = "artifact_id is required")
    @JsonProperty("artifact_id")
    private String artifactId;

    /**
     * Overrides applied on top of the configured mining defaults.
     */
    @JsonProperty("mining_config")
    private JsonNode miningConfig;
}
