package com.motif.integration.service.client.builder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.motif.integration.service.client.DownstreamCalls;
import com.motif.integration.service.client.DownstreamResponse;
import com.motif.integration.service.outcome.ErrorKind;
import com.motif.integration.service.outcome.StageOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;

/**
 * {@link GraphBuilderClient} backed by Spring's {@link RestClient}.
 *
 * Two clients are used: one with the long generation timeout for
 * {@code POST load}, one with the short readiness timeout for job status.
 */
@Slf4j
public class RestGraphBuilderClient implements GraphBuilderClient {

    static final String SERVICE_NAME = "graph builder";

    private final RestClient loadClient;
    private final RestClient statusClient;
    private final ObjectMapper objectMapper;
    private final ArtifactLocator artifactLocator;
    private final String loadPath;
    private final String statusPath;

    public RestGraphBuilderClient(RestClient loadClient,
                                  RestClient statusClient,
                                  ObjectMapper objectMapper,
                                  ArtifactLocator artifactLocator,
                                  String loadPath,
                                  String statusPath) {
        this.loadClient = loadClient;
        this.statusClient = statusClient;
        this.objectMapper = objectMapper;
        this.artifactLocator = artifactLocator;
        this.loadPath = loadPath;
        this.statusPath = statusPath;
    }

    // ==================== Generation ====================

    @Override
    public StageOutcome<BuildResult> generate(BuildRequest request) {
        log.debug("Requesting {} graph: tenant={}, session={}, files={}",
                request.writerKind().wireValue(), request.tenantId(), request.sessionId(),
                request.inputFiles().size());

        return DownstreamCalls.execute(SERVICE_NAME,
                () -> DownstreamCalls.exchange(loadClient.post()
                        .uri(loadPath)
                        .contentType(MediaType.MULTIPART_FORM_DATA)
                        .body(buildMultipartBody(request))),
                response -> toBuildResult(request.writerKind(), response));
    }

    private MultiValueMap<String, Object> buildMultipartBody(BuildRequest request) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        for (Path inputFile : request.inputFiles()) {
            body.add("files", new FileSystemResource(inputFile));
        }
        body.add("config", new FileSystemResource(request.configFile()));
        body.add("schema_json", new FileSystemResource(request.schemaFile()));
        body.add("writer_type", request.writerKind().wireValue());
        body.add("tenant_id", request.tenantId());
        if (request.sessionId() != null) {
            body.add("session_id", request.sessionId());
        }
        return body;
    }

    private StageOutcome<BuildResult> toBuildResult(WriterKind writerKind, DownstreamResponse response) {
        return DownstreamCalls.readJson(SERVICE_NAME, objectMapper, response)
                .flatMap(json -> {
                    String jobId = textOrNull(json, "job_id");
                    if (jobId == null || jobId.isBlank()) {
                        return StageOutcome.failure(ErrorKind.INVALID_RESPONSE,
                                SERVICE_NAME + " response has no job_id: " + response.abbreviatedBody());
                    }
                    String location = artifactLocator.locate(jobId, writerKind).toString();
                    log.info("Builder accepted {} job {} (artifact: {})", writerKind.wireValue(), jobId, location);
                    return StageOutcome.success(
                            new BuildResult(jobId, textOrNull(json, "status"), writerKind, location));
                });
    }

    // ==================== Job Status ====================

    @Override
    public StageOutcome<JobStatus> fetchJobStatus(String jobId) {
        log.debug("Fetching builder job status: {}", jobId);

        return DownstreamCalls.execute(SERVICE_NAME,
                () -> DownstreamCalls.exchange(statusClient.get().uri(statusPath, jobId)),
                response -> DownstreamCalls.readJson(SERVICE_NAME, objectMapper, response)
                        .flatMap(json -> {
                            String status = textOrNull(json, "status");
                            if (status == null) {
                                return StageOutcome.failure(ErrorKind.INVALID_RESPONSE,
                                        SERVICE_NAME + " status response has no status field: "
                                                + response.abbreviatedBody());
                            }
                            return StageOutcome.success(new JobStatus(jobId, status, textOrNull(json, "graph_type")));
                        }));
    }

    private static String textOrNull(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
