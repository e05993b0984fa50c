package com.motif.integration.service.pipeline.workspace;

import com.motif.integration.service.pipeline.PipelineRequest;
import com.motif.integration.service.pipeline.TabularInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.InputStreamSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIOException;

class RunWorkspaceFactoryTest {

    @TempDir
    Path root;

    private RunWorkspaceFactory factory;

    @BeforeEach
    void setUp() {
        factory = new RunWorkspaceFactory(root);
    }

    @Test
    void open_materializesInputsConfigAndSchema() throws IOException {
        var request = request(List.of(
                csv("people.csv", "id,name\n1,Ada\n"),
                csv("orders.csv", "id,total\n7,12.50\n")));

        try (RunWorkspace workspace = factory.open("run-1", request)) {
            assertThat(workspace.runId()).isEqualTo("run-1");
            assertThat(workspace.directory()).startsWith(root).isDirectory();
            assertThat(workspace.inputFiles()).hasSize(2);
            assertThat(workspace.inputFiles().get(0).getFileName()).hasToString("0-people.csv");
            assertThat(workspace.inputFiles().get(1)).hasContent("id,total\n7,12.50\n");
            assertThat(workspace.configFile()).hasContent("{\"nodes\":[]}");
            assertThat(workspace.schemaFile()).hasContent("{\"types\":{}}");
        }
    }

    @Test
    void close_deletesDirectoryAndIsIdempotent() throws IOException {
        RunWorkspace workspace = factory.open("run-2", request(List.of(csv("a.csv", "x\n1\n"))));
        Path directory = workspace.directory();

        workspace.close();
        workspace.close();

        assertThat(directory).doesNotExist();
    }

    @Test
    void open_failedCopyLeavesNothingBehind() {
        InputStreamSource broken = () -> {
            throw new IOException("upload stream closed");
        };
        var request = request(List.of(csv("a.csv", "x\n"), new TabularInput("b.csv", broken)));

        assertThatIOException()
                .isThrownBy(() -> factory.open("run-3", request))
                .withMessage("upload stream closed");
        assertThat(listRoot()).isEmpty();
    }

    @Test
    void safeFileName_stripsPathsAndUnsafeCharacters() {
        assertThat(RunWorkspaceFactory.safeFileName("../../etc/passwd", 0)).isEqualTo("0-passwd");
        assertThat(RunWorkspaceFactory.safeFileName("C:\\data\\my file.csv", 1)).isEqualTo("1-my_file.csv");
        assertThat(RunWorkspaceFactory.safeFileName(null, 2)).isEqualTo("2-input.csv");
        assertThat(RunWorkspaceFactory.safeFileName("..", 3)).isEqualTo("3-input.csv");
    }

    private List<Path> listRoot() {
        try (Stream<Path> children = Files.list(root)) {
            return children.toList();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static PipelineRequest request(List<TabularInput> inputs) {
        return new PipelineRequest(inputs, "{\"nodes\":[]}", "{\"types\":{}}", null, null, null);
    }

    private static TabularInput csv(String name, String content) {
        return new TabularInput(name, new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8)));
    }
}
