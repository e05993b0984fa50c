package com.motif.integration.service.client.miner;

import com.motif.integration.service.mining.MiningConfiguration;

import java.nio.file.Path;

/**
 * One mining call: the artifact to upload and the resolved configuration.
 *
 * @param artifactPath  primary graph artifact on the shared volume
 * @param configuration mining parameters with the graph kind already resolved
 */
public record MiningJob(Path artifactPath, MiningConfiguration configuration) {}
