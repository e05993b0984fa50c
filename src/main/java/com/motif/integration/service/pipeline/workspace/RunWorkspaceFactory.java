package com.motif.integration.service.pipeline.workspace;

import com.motif.integration.service.config.PipelineConfig;
import com.motif.integration.service.pipeline.PipelineRequest;
import com.motif.integration.service.pipeline.TabularInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates per-run scratch workspaces under the configured workspace root.
 */
@Slf4j
@Component
public class RunWorkspaceFactory {

    static final String CONFIG_FILE_NAME = "config.json";
    static final String SCHEMA_FILE_NAME = "schema.json";

    private final Path root;

    @Autowired
    public RunWorkspaceFactory(PipelineConfig pipelineConfig) {
        this(resolveRoot(pipelineConfig.getStorage().getWorkspaceRoot()));
    }

    RunWorkspaceFactory(Path root) {
        this.root = root;
    }

    /**
     * Materializes a request's inputs into a fresh workspace.
     *
     * Nothing is left behind if materialization fails part way.
     *
     * @throws IOException if the workspace cannot be written
     */
    public RunWorkspace open(String runId, PipelineRequest request) throws IOException {
        Files.createDirectories(root);
        Path directory = Files.createTempDirectory(root, "run-" + runId + "-");
        try {
            List<Path> inputFiles = copyInputs(directory, request.inputs());
            Path configFile = Files.writeString(directory.resolve(CONFIG_FILE_NAME),
                    nullToEmpty(request.config()), StandardCharsets.UTF_8);
            Path schemaFile = Files.writeString(directory.resolve(SCHEMA_FILE_NAME),
                    nullToEmpty(request.schema()), StandardCharsets.UTF_8);

            log.debug("Prepared workspace for run {}: {} ({} input files)", runId, directory, inputFiles.size());
            return new RunWorkspace(runId, directory, inputFiles, configFile, schemaFile);
        } catch (IOException | RuntimeException e) {
            discard(directory, e);
            throw e;
        }
    }

    private List<Path> copyInputs(Path directory, List<TabularInput> inputs) throws IOException {
        Path inputDirectory = Files.createDirectory(directory.resolve("input"));
        var files = new ArrayList<Path>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            TabularInput input = inputs.get(i);
            Path target = inputDirectory.resolve(safeFileName(input.fileName(), i));
            try (InputStream in = input.content().getInputStream()) {
                Files.copy(in, target);
            }
            files.add(target);
        }
        return files;
    }

    private void discard(Path directory, Exception failure) {
        try {
            FileSystemUtils.deleteRecursively(directory);
        } catch (IOException cleanupError) {
            failure.addSuppressed(cleanupError);
        }
    }

    /**
     * Strips directories and unsafe characters from client-supplied names.
     * The index prefix keeps names unique within a run.
     */
    static String safeFileName(String fileName, int index) {
        String name = fileName == null ? "" : fileName;
        int separator = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        name = name.substring(separator + 1).replaceAll("[^A-Za-z0-9._-]", "_");
        if (name.isBlank() || name.chars().allMatch(c -> c == '.')) {
            name = "input.csv";
        }
        return index + "-" + name;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static Path resolveRoot(String configuredRoot) {
        if (configuredRoot == null || configuredRoot.isBlank()) {
            return Path.of(System.getProperty("java.io.tmpdir"), "motif-integration");
        }
        return Path.of(configuredRoot);
    }
}
