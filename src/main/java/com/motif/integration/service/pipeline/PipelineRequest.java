package com.motif.integration.service.pipeline;

import com.motif.integration.service.mining.MiningConfiguration;

import java.util.List;

/**
 * Input of {@link PipelineCoordinator#runPipeline(PipelineRequest)}.
 *
 * @param inputs              tabular files to build graphs from
 * @param config              builder configuration document
 * @param schema              builder schema document
 * @param tenantId            tenant, null for the configured default
 * @param sessionId           caller correlation token, null to generate one
 * @param miningConfiguration mining parameters, null for the configured defaults
 */
public record PipelineRequest(
        List<TabularInput> inputs,
        String config,
        String schema,
        String tenantId,
        String sessionId,
        MiningConfiguration miningConfiguration
) {

    public PipelineRequest {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }
}
