package com.motif.integration.service.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.motif.integration.service.aggregate.BranchOutcomes;
import com.motif.integration.service.aggregate.PartialFailureAggregator;
import com.motif.integration.service.client.annotation.AnnotationClient;
import com.motif.integration.service.client.builder.ArtifactLocator;
import com.motif.integration.service.client.builder.BuildRequest;
import com.motif.integration.service.client.builder.BuildResult;
import com.motif.integration.service.client.builder.GraphBuilderClient;
import com.motif.integration.service.client.builder.WriterKind;
import com.motif.integration.service.client.miner.MinerClient;
import com.motif.integration.service.client.miner.MiningJob;
import com.motif.integration.service.client.miner.MiningResult;
import com.motif.integration.service.config.MetricsConfig;
import com.motif.integration.service.config.PipelineConfig;
import com.motif.integration.service.mining.MiningConfiguration;
import com.motif.integration.service.mining.MiningRequest;
import com.motif.integration.service.mining.MiningRequestValidator;
import com.motif.integration.service.outcome.ErrorKind;
import com.motif.integration.service.outcome.StageOutcome;
import com.motif.integration.service.pipeline.workspace.RunWorkspace;
import com.motif.integration.service.pipeline.workspace.RunWorkspaceFactory;
import com.motif.integration.service.readiness.ReadinessProber;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orchestrates the graph-building, mining and annotation services.
 *
 * A run generates the primary graph first, then fans out secondary graph
 * generation and mining through the {@link PartialFailureAggregator}. One
 * failing branch never hides the other branch's result. Annotation is a
 * separate entry point gated on the secondary job's readiness.
 *
 * Every entry point returns a structured result; downstream failures are never
 * thrown to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineCoordinator {

    private final GraphBuilderClient graphBuilderClient;
    private final MinerClient minerClient;
    private final AnnotationClient annotationClient;
    private final ReadinessProber readinessProber;
    private final PartialFailureAggregator aggregator;
    private final RunWorkspaceFactory workspaceFactory;
    private final MiningRequestValidator miningRequestValidator;
    private final ArtifactLocator artifactLocator;
    private final PipelineConfig pipelineConfig;
    private final MetricsConfig metricsConfig;

    private final AtomicInteger activeRuns = new AtomicInteger(0);

    @PostConstruct
    void registerMetrics() {
        metricsConfig.registerGauge(
                "pipeline.run.active",
                "Number of pipeline runs in flight",
                activeRuns::get
        );
    }

    // ==================== Pipeline Run ====================

    /**
     * Runs the full pipeline: primary graph, then secondary graph and mining in parallel.
     *
     * @param request the uploaded inputs and parameters
     * @return the run in a terminal state
     */
    public PipelineRun runPipeline(PipelineRequest request) {
        var run = createRun(request);
        var sample = Timer.start(metricsConfig.getRegistry());
        activeRuns.incrementAndGet();

        try {
            executeRun(run, request);
        } finally {
            activeRuns.decrementAndGet();
            sample.stop(metricsConfig.getRunTimer());
            recordRunOutcome(run);
        }
        return run;
    }

    /**
     * Number of runs currently executing.
     */
    public int getActiveRunCount() {
        return activeRuns.get();
    }

    private PipelineRun createRun(PipelineRequest request) {
        return PipelineRun.builder()
                .runId(UUID.randomUUID().toString())
                .tenantId(isBlank(request.tenantId())
                        ? pipelineConfig.getTenant().getDefaultTenantId()
                        : request.tenantId())
                .sessionId(isBlank(request.sessionId())
                        ? UUID.randomUUID().toString()
                        : request.sessionId())
                .build();
    }

    private void executeRun(PipelineRun run, PipelineRequest request) {
        MiningConfiguration miningConfiguration = resolveMiningConfiguration(request.miningConfiguration());
        Optional<PipelineError> rejection = validateRunRequest(request, miningConfiguration);
        if (rejection.isPresent()) {
            failRun(run, rejection.get());
            return;
        }

        try (RunWorkspace workspace = workspaceFactory.open(run.getRunId(), request)) {
            runStages(run, workspace, miningConfiguration);
        } catch (IOException e) {
            log.error("Failed to prepare workspace for run {}", run.getRunId(), e);
            failRun(run, PipelineError.of(PipelineError.STAGE_WORKSPACE, ErrorKind.INTERNAL,
                    "Failed to prepare run workspace: " + e.getMessage()));
        }
    }

    private Optional<PipelineError> validateRunRequest(PipelineRequest request,
                                                       MiningConfiguration miningConfiguration) {
        var violations = new ArrayList<String>();
        if (request.inputs().isEmpty()) {
            violations.add("at least one tabular input file is required");
        }
        violations.addAll(miningRequestValidator.validate(miningConfiguration));

        if (violations.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(PipelineError.of(PipelineError.STAGE_VALIDATION, ErrorKind.VALIDATION,
                String.join("; ", violations)));
    }

    private void runStages(PipelineRun run, RunWorkspace workspace, MiningConfiguration miningConfiguration) {
        transition(run, PipelineStatus.PRIMARY_GENERATING);
        var primaryRequest = new BuildRequest(
                workspace.inputFiles(),
                workspace.configFile(),
                workspace.schemaFile(),
                WriterKind.NETWORKX,
                run.getTenantId(),
                run.getSessionId());

        StageOutcome<BuildResult> primary = graphBuilderClient.generate(primaryRequest);
        if (primary instanceof StageOutcome.Failure<BuildResult> failure) {
            failRun(run, PipelineError.of(PipelineError.STAGE_PRIMARY_GRAPH, failure));
            return;
        }

        BuildResult primaryResult = primary.value().orElseThrow();
        run.setStage1JobId(primaryResult.jobId());
        run.setPrimaryArtifactLocation(primaryResult.artifactLocation());

        transition(run, PipelineStatus.BRANCHING);
        BranchOutcomes<BuildResult, MiningResult> outcomes = aggregator.joinAll(
                () -> graphBuilderClient.generate(primaryRequest.withWriter(WriterKind.NEO4J)),
                () -> mineArtifact(primaryResult.jobId(),
                        Path.of(primaryResult.artifactLocation()), miningConfiguration));

        mergeBranches(run, outcomes);
    }

    // ==================== Branch Merge ====================

    private void mergeBranches(PipelineRun run, BranchOutcomes<BuildResult, MiningResult> outcomes) {
        StageOutcome<BuildResult> secondary = outcomes.first();
        StageOutcome<MiningResult> mining = outcomes.second();

        secondary.value().ifPresent(result -> {
            run.setStage2JobId(result.jobId());
            run.setStage2Ready(true);
        });
        mining.value().ifPresent(result -> {
            run.setMotifs(new ArrayList<>(result.motifs()));
            run.setStatistics(result.statistics());
        });

        var branchErrors = new ArrayList<PipelineError>();
        secondary.failure().ifPresent(failure ->
                branchErrors.add(PipelineError.of(PipelineError.STAGE_SECONDARY_GRAPH, failure)));
        mining.failure().ifPresent(failure ->
                branchErrors.add(PipelineError.of(PipelineError.STAGE_MINING, failure)));
        run.setBranchErrors(branchErrors);

        if (outcomes.allSucceeded()) {
            transition(run, PipelineStatus.SUCCESS);
        } else if (outcomes.allFailed()) {
            run.setError(PipelineError.aggregate(PipelineError.STAGE_BRANCHES, branchErrors));
            transition(run, PipelineStatus.TOTAL_FAILURE);
        } else {
            run.setError(branchErrors.get(0));
            logBranchFailure(run, branchErrors.get(0));
            transition(run, PipelineStatus.PARTIAL_FAILURE);
        }
    }

    // ==================== Mining ====================

    /**
     * Mines a previously generated primary artifact.
     *
     * @param request the artifact and mining parameters
     * @return the mining result, never null
     */
    public MiningRunResult mine(MiningRequest request) {
        String artifactId = request.downstreamArtifactId();
        var sample = Timer.start(metricsConfig.getRegistry());

        try {
            MiningConfiguration configuration = resolveMiningConfiguration(request.configuration());
            var violations = new ArrayList<>(miningRequestValidator.validate(configuration));
            if (isBlank(artifactId)) {
                violations.add(0, "downstream artifact ID is required");
            }
            if (!violations.isEmpty()) {
                return MiningRunResult.failure(artifactId, PipelineError.of(
                        PipelineError.STAGE_VALIDATION, ErrorKind.VALIDATION, String.join("; ", violations)));
            }

            Path artifactPath;
            try {
                artifactPath = artifactLocator.locate(artifactId, WriterKind.NETWORKX);
            } catch (IllegalArgumentException e) {
                return MiningRunResult.failure(artifactId, PipelineError.of(
                        PipelineError.STAGE_VALIDATION, ErrorKind.VALIDATION, e.getMessage()));
            }

            StageOutcome<MiningResult> outcome = mineArtifact(artifactId, artifactPath, configuration);
            metricsConfig.getMiningRequestsCompleted().increment();
            if (outcome instanceof StageOutcome.Failure<MiningResult> failure) {
                log.warn("Mining failed for artifact {}: {} [{}]", artifactId, failure.message(), failure.kind());
                return MiningRunResult.failure(artifactId, PipelineError.of(PipelineError.STAGE_MINING, failure));
            }

            MiningResult result = outcome.value().orElseThrow();
            log.info("Mining completed for artifact {}: {} motifs", artifactId, result.motifs().size());
            return MiningRunResult.success(artifactId, result.motifs(), result.statistics());
        } finally {
            sample.stop(metricsConfig.getMiningTimer());
        }
    }

    /**
     * Resolves the graph kind if needed, then calls the miner.
     */
    private StageOutcome<MiningResult> mineArtifact(String artifactJobId, Path artifactPath,
                                                    MiningConfiguration configuration) {
        return resolveGraphKind(artifactJobId, configuration)
                .flatMap(resolved -> minerClient.mine(new MiningJob(artifactPath, resolved)));
    }

    /**
     * Derives a missing graph kind from the artifact metadata reported by the builder.
     */
    private StageOutcome<MiningConfiguration> resolveGraphKind(String artifactJobId,
                                                               MiningConfiguration configuration) {
        if (configuration.hasGraphKind()) {
            return StageOutcome.success(configuration);
        }

        log.debug("Resolving graph kind from metadata of artifact {}", artifactJobId);
        return graphBuilderClient.fetchJobStatus(artifactJobId)
                .flatMap(status -> status.graphKind()
                        .map(kind -> StageOutcome.success(configuration.toBuilder().graphKind(kind).build()))
                        .orElseGet(() -> StageOutcome.<MiningConfiguration>failure(ErrorKind.INVALID_RESPONSE,
                                "Artifact metadata for job " + artifactJobId + " has no usable graph_type")));
    }

    private MiningConfiguration resolveMiningConfiguration(MiningConfiguration requested) {
        return requested != null
                ? requested
                : MiningConfiguration.fromDefaults(pipelineConfig.getMining());
    }

    // ==================== Annotation ====================

    /**
     * Annotates a selected motif once the graph-database job reports completion.
     *
     * The readiness check is a single probe; a job still in progress fails with
     * NOT_READY and the caller is expected to retry later.
     *
     * @param selection the selected motif and its graph-database job
     * @return the annotation result, never null
     */
    public AnnotationResult annotate(MotifSelection selection) {
        var result = AnnotationResult.builder()
                .runId(selection.runId())
                .stage2JobId(selection.stage2JobId())
                .build();
        var sample = Timer.start(metricsConfig.getRegistry());

        try {
            executeAnnotation(result, selection);
        } finally {
            sample.stop(metricsConfig.getAnnotationTimer());
        }
        return result;
    }

    private void executeAnnotation(AnnotationResult result, MotifSelection selection) {
        if (isBlank(selection.stage2JobId()) || isMissing(selection.motif())) {
            failAnnotation(result, PipelineError.of(PipelineError.STAGE_VALIDATION, ErrorKind.VALIDATION,
                    "stage2JobId and motif are required"));
            return;
        }

        if (!readinessProber.isReady(selection.stage2JobId())) {
            metricsConfig.getAnnotationsNotReady().increment();
            failAnnotation(result, PipelineError.of(PipelineError.STAGE_READINESS, ErrorKind.NOT_READY,
                    "Graph database job " + selection.stage2JobId() + " is not ready"));
            return;
        }
        result.setStatus(AnnotationStatus.ANNOTATION_READY);

        StageOutcome<JsonNode> outcome = annotationClient.annotate(selection.stage2JobId(), selection.motif());
        if (outcome instanceof StageOutcome.Failure<JsonNode> failure) {
            failAnnotation(result, PipelineError.of(PipelineError.STAGE_ANNOTATION, failure));
            return;
        }

        result.setAnnotation(outcome.value().orElse(null));
        result.setStatus(AnnotationStatus.SUCCESS);
        metricsConfig.getAnnotationsSucceeded().increment();
        log.info("Annotation completed: runId={}, stage2JobId={}", selection.runId(), selection.stage2JobId());
    }

    private void failAnnotation(AnnotationResult result, PipelineError error) {
        result.setError(error);
        result.setStatus(AnnotationStatus.FAILURE);
        if (error.kind() != ErrorKind.NOT_READY) {
            metricsConfig.getAnnotationsFailed().increment();
        }
        log.warn("Annotation failed: runId={}, stage2JobId={}, {} [{}]",
                result.getRunId(), result.getStage2JobId(), error.message(), error.kind());
    }

    // ==================== State & Metrics ====================

    private void transition(PipelineRun run, PipelineStatus next) {
        log.info("Run {} {} -> {}", run.getRunId(), run.getStatus(), next);
        run.setStatus(next);
    }

    private void failRun(PipelineRun run, PipelineError error) {
        run.setError(error);
        log.warn("Run {} failed at {}: {} [{}]", run.getRunId(), error.stage(), error.message(), error.kind());
        transition(run, PipelineStatus.TOTAL_FAILURE);
    }

    private void recordRunOutcome(PipelineRun run) {
        switch (run.getStatus()) {
            case SUCCESS -> metricsConfig.getRunsSucceeded().increment();
            case PARTIAL_FAILURE -> metricsConfig.getRunsPartiallyFailed().increment();
            default -> metricsConfig.getRunsFailed().increment();
        }
    }

    private void logBranchFailure(PipelineRun run, PipelineError error) {
        log.warn("Run {} partially failed, {} branch: {} [{}]",
                run.getRunId(), error.stage(), error.message(), error.kind());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static boolean isMissing(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }
}
