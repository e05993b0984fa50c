package com.motif.integration.service.client.builder;

import java.nio.file.Path;

/**
 * Resolves where the builder places an artifact on the shared volume.
 *
 * Layout: {@code <shared>/<jobId>/<artifact file>} or the job directory itself
 * for writers without a single artifact file.
 */
public class ArtifactLocator {

    private final Path sharedOutputPath;

    public ArtifactLocator(String sharedOutputPath) {
        this.sharedOutputPath = Path.of(sharedOutputPath);
    }

    public Path locate(String jobId, WriterKind writerKind) {
        if (jobId == null || jobId.isBlank() || jobId.contains("/") || jobId.contains("..")) {
            throw new IllegalArgumentException("Invalid artifact job ID: " + jobId);
        }
        Path jobDirectory = sharedOutputPath.resolve(jobId);
        String fileName = writerKind.artifactFileName();
        return fileName == null ? jobDirectory : jobDirectory.resolve(fileName);
    }
}
