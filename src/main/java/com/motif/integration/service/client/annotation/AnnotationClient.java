package com.motif.integration.service.client.annotation;

import com.fasterxml.jackson.databind.JsonNode;
import com.motif.integration.service.outcome.StageOutcome;

/**
 * Adapter for the annotation service.
 */
public interface AnnotationClient {

    /**
     * Sends a selected motif for annotation against a graph-database job.
     *
     * @param correlationId builder job ID of the graph-database artifact
     * @param motif         the selected motif
     * @return the annotation payload unchanged, or a failure; never throws
     */
    StageOutcome<JsonNode> annotate(String correlationId, JsonNode motif);
}
