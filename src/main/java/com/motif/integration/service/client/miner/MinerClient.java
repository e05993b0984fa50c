package com.motif.integration.service.client.miner;

import com.motif.integration.service.outcome.StageOutcome;

/**
 * Adapter for the motif-miner service.
 */
public interface MinerClient {

    /**
     * Uploads a graph artifact and mines it.
     *
     * @param job the artifact and parameters
     * @return motifs and statistics, or a failure; never throws
     */
    StageOutcome<MiningResult> mine(MiningJob job);
}
