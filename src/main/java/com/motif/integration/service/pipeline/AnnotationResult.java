package com.motif.integration.service.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * State and result of one annotation request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnnotationResult {

    private String runId;
    private String stage2JobId;

    @Builder.Default
    private AnnotationStatus status = AnnotationStatus.AWAITING_READINESS;

    /**
     * Annotation service payload, passed through unchanged.
     */
    private JsonNode annotation;

    private PipelineError error;
}
