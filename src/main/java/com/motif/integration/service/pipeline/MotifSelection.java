package com.motif.integration.service.pipeline;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A motif chosen by the user for annotation.
 *
 * @param runId       run the motif came from
 * @param stage2JobId graph-database job the motif is annotated against
 * @param motif       the selected motif as returned by the miner
 */
public record MotifSelection(String runId, String stage2JobId, JsonNode motif) {}
