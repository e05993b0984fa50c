package com.motif.integration.service.client.builder;

/**
 * Successful graph-builder load.
 *
 * @param jobId            job ID assigned by the builder
 * @param status           status reported with the job, may be null
 * @param writerKind       writer that produced the artifact
 * @param artifactLocation shared-storage location of the artifact
 */
public record BuildResult(
        String jobId,
        String status,
        WriterKind writerKind,
        String artifactLocation
) {}
