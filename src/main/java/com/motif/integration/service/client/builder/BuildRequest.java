package com.motif.integration.service.client.builder;

import java.nio.file.Path;
import java.util.List;

/**
 * Inputs of one graph-builder load call.
 *
 * @param inputFiles CSV files to upload
 * @param configFile builder configuration document
 * @param schemaFile schema document
 * @param writerKind output writer to use
 * @param tenantId   tenant the run belongs to
 * @param sessionId  correlation token, may be null
 */
public record BuildRequest(
        List<Path> inputFiles,
        Path configFile,
        Path schemaFile,
        WriterKind writerKind,
        String tenantId,
        String sessionId
) {

    public BuildRequest {
        inputFiles = List.copyOf(inputFiles);
    }

    /**
     * Same inputs, different writer.
     */
    public BuildRequest withWriter(WriterKind writer) {
        return new BuildRequest(inputFiles, configFile, schemaFile, writer, tenantId, sessionId);
    }
}
