package com.motif.integration.service.client.miner;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Validated miner output.
 *
 * @param motifs     discovered motifs, passed through as returned
 * @param statistics mining statistics, passed through as returned
 */
public record MiningResult(List<JsonNode> motifs, JsonNode statistics) {

    public MiningResult {
        motifs = List.copyOf(motifs);
    }
}
