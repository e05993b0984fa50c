package com.motif.integration.service.api.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.motif.integration.service.api.dto.AnnotateRequest;
import com.motif.integration.service.api.dto.ApiResponse;
import com.motif.integration.service.api.dto.MineRequest;
import com.motif.integration.service.client.builder.GraphBuilderClient;
import com.motif.integration.service.client.builder.JobStatus;
import com.motif.integration.service.config.PipelineConfig;
import com.motif.integration.service.mining.MiningConfiguration;
import com.motif.integration.service.mining.MiningRequest;
import com.motif.integration.service.mining.MiningRequestValidator;
import com.motif.integration.service.outcome.ErrorKind;
import com.motif.integration.service.outcome.StageOutcome;
import com.motif.integration.service.pipeline.AnnotationResult;
import com.motif.integration.service.pipeline.AnnotationStatus;
import com.motif.integration.service.pipeline.MiningRunResult;
import com.motif.integration.service.pipeline.MotifSelection;
import com.motif.integration.service.pipeline.PipelineCoordinator;
import com.motif.integration.service.pipeline.PipelineError;
import com.motif.integration.service.pipeline.PipelineRequest;
import com.motif.integration.service.pipeline.PipelineRun;
import com.motif.integration.service.pipeline.PipelineStatus;
import com.motif.integration.service.pipeline.TabularInput;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Controller for pipeline execution, mining and annotation.
 *
 * Results are always returned as structured bodies. The HTTP status reflects
 * the outcome: validation problems map to 400, an unready graph database to
 * 409 and downstream failures to 502. A partially failed run is still a 200
 * because its surviving branch is usable.
 */
@Slf4j
@RestController
@RequestMapping("/api/pipeline")
@Tag(name = "Pipeline", description = "Graph generation, motif mining and annotation")
@RequiredArgsConstructor
public class PipelineController {

    private static final String CSV_EXTENSION = ".csv";

    private final PipelineCoordinator coordinator;
    private final GraphBuilderClient graphBuilderClient;
    private final PipelineConfig pipelineConfig;
    private final MiningRequestValidator miningRequestValidator;
    private final ObjectMapper objectMapper;

    @Value("${spring.application.name:motif-integration-service}")
    private String serviceName;

    // ==================== Pipeline ====================

    @PostMapping(value = "/execute", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "Execute the full pipeline",
            description = "Builds the primary graph from the uploaded CSV files, then generates the " +
                    "graph-database artifact and mines motifs in parallel."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Run succeeded or partially failed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid input"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Downstream services failed")
    })
    public ResponseEntity<ApiResponse<PipelineRun>> executePipeline(
            @RequestParam("file") List<MultipartFile> files,
            @RequestParam("config") String config,
            @RequestParam("schema_json") String schemaJson,
            @RequestParam(value = "tenant_id", required = false) String tenantId,
            @RequestParam(value = "session_id", required = false) String sessionId,
            @Parameter(description = "JSON object overriding the default mining parameters")
            @RequestParam(value = "mining_config", required = false) String miningConfig) {

        for (MultipartFile file : files) {
            if (!isCsv(file.getOriginalFilename())) {
                log.warn("Rejecting non-CSV upload: {}", file.getOriginalFilename());
                return ResponseEntity.badRequest()
                        .body(ApiResponse.error("Only CSV files are supported",
                                "UNSUPPORTED_FILE_TYPE", file.getOriginalFilename()));
            }
        }

        List<TabularInput> inputs = files.stream()
                .map(file -> new TabularInput(file.getOriginalFilename(), file))
                .toList();
        var request = new PipelineRequest(inputs, config, schemaJson, tenantId, sessionId,
                resolveMiningConfiguration(parseOverrides(miningConfig)));

        log.info("Executing pipeline: {} file(s), tenant={}", inputs.size(), tenantId);
        PipelineRun run = coordinator.runPipeline(request);

        if (run.getStatus() == PipelineStatus.TOTAL_FAILURE) {
            return failure(run, run.getError());
        }
        return ResponseEntity.ok(ApiResponse.success(run));
    }

    // ==================== Mining ====================

    @PostMapping("/mine")
    @Operation(summary = "Mine an existing graph artifact",
            description = "Runs the motif miner on a primary graph generated by an earlier run.")
    public ResponseEntity<ApiResponse<MiningRunResult>> mine(@Valid @RequestBody MineRequest request) {
        var miningRequest = new MiningRequest(request.getArtifactId(),
                resolveMiningConfiguration(request.getMiningConfig()));

        MiningRunResult result = coordinator.mine(miningRequest);
        if (result.status() != PipelineStatus.SUCCESS) {
            return failure(result, result.error());
        }
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    // ==================== Annotation ====================

    @PostMapping("/annotate")
    @Operation(summary = "Annotate a selected motif",
            description = "Annotates a motif against the graph database once its load job has completed. " +
                    "Returns 409 while the job is still in progress.")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Annotation produced"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Graph database not ready"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Annotation service failed")
    })
    public ResponseEntity<ApiResponse<AnnotationResult>> annotate(@Valid @RequestBody AnnotateRequest request) {
        var selection = new MotifSelection(request.getJobId(), request.getNeo4jJobId(), request.getSelectedMotif());

        AnnotationResult result = coordinator.annotate(selection);
        if (result.getStatus() != AnnotationStatus.SUCCESS) {
            return failure(result, result.getError());
        }
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    // ==================== Jobs & Health ====================

    @GetMapping("/job/{jobId}")
    @Operation(summary = "Get builder job status")
    public ResponseEntity<ApiResponse<JobStatus>> getJobStatus(@PathVariable String jobId) {
        StageOutcome<JobStatus> outcome = graphBuilderClient.fetchJobStatus(jobId);
        if (outcome instanceof StageOutcome.Failure<JobStatus> failure) {
            return ResponseEntity.status(statusFor(failure.kind()))
                    .body(ApiResponse.error(failure.message(), failure.kind().name()));
        }
        return ResponseEntity.ok(ApiResponse.success(outcome.value().orElseThrow()));
    }

    @GetMapping("/health")
    @Operation(summary = "Liveness check")
    public Map<String, String> health() {
        return Map.of("status", "healthy", "service", serviceName);
    }

    // ==================== Helper Methods ====================

    private JsonNode parseOverrides(String miningConfig) {
        if (miningConfig == null || miningConfig.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(miningConfig);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("mining_config is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Applies request overrides on top of the configured mining defaults.
     *
     * Unknown keys and out-of-range values are rejected before the request
     * reaches the coordinator.
     */
    private MiningConfiguration resolveMiningConfiguration(JsonNode overrides) {
        MiningConfiguration defaults = MiningConfiguration.fromDefaults(pipelineConfig.getMining());
        if (overrides == null || overrides.isNull()) {
            return defaults;
        }
        if (!overrides.isObject()) {
            throw new IllegalArgumentException("mining_config must be a JSON object");
        }

        MiningConfiguration merged;
        try {
            merged = objectMapper.readerForUpdating(defaults)
                    .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(overrides);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid mining_config: " + e.getMessage(), e);
        }

        List<String> violations = miningRequestValidator.validate(merged);
        if (!violations.isEmpty()) {
            throw new IllegalArgumentException("Invalid mining_config: " + String.join("; ", violations));
        }
        return merged;
    }

    private <T> ResponseEntity<ApiResponse<T>> failure(T data, PipelineError error) {
        ErrorKind kind = error != null ? error.kind() : ErrorKind.INTERNAL;
        String message = error != null ? error.message() : "Request failed";
        return ResponseEntity.status(statusFor(kind))
                .body(ApiResponse.failure(data, message, kind.name()));
    }

    private static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_READY -> HttpStatus.CONFLICT;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
            default -> HttpStatus.BAD_GATEWAY;
        };
    }

    private static boolean isCsv(String fileName) {
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(CSV_EXTENSION);
    }
}
