package com.motif.integration.service.mining;

/**
 * Request to mine a previously generated primary artifact.
 *
 * @param downstreamArtifactId builder job ID of the artifact to mine
 * @param configuration        mining parameters, null for the configured defaults
 */
public record MiningRequest(
        String downstreamArtifactId,
        MiningConfiguration configuration
) {}
