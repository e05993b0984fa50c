package com.motif.integration.service.pipeline.workspace;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Scratch directory owned by exactly one pipeline run.
 *
 * Holds the uploaded CSV files and the generated config and schema documents.
 * Closing it deletes the directory; open it in try-with-resources so every
 * exit path releases it.
 */
@Slf4j
public final class RunWorkspace implements AutoCloseable {

    private final String runId;
    private final Path directory;
    private final List<Path> inputFiles;
    private final Path configFile;
    private final Path schemaFile;
    private boolean closed;

    RunWorkspace(String runId, Path directory, List<Path> inputFiles, Path configFile, Path schemaFile) {
        this.runId = runId;
        this.directory = directory;
        this.inputFiles = List.copyOf(inputFiles);
        this.configFile = configFile;
        this.schemaFile = schemaFile;
    }

    public String runId() {
        return runId;
    }

    public Path directory() {
        return directory;
    }

    public List<Path> inputFiles() {
        return inputFiles;
    }

    public Path configFile() {
        return configFile;
    }

    public Path schemaFile() {
        return schemaFile;
    }

    /**
     * Deletes the workspace directory. Idempotent.
     *
     * A failed delete is logged, not thrown, so it cannot mask the run result.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            FileSystemUtils.deleteRecursively(directory);
            log.debug("Released workspace for run {}: {}", runId, directory);
        } catch (IOException e) {
            log.warn("Failed to delete workspace {} for run {}", directory, runId, e);
        }
    }
}
