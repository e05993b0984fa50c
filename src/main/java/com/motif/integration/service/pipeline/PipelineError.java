package com.motif.integration.service.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.motif.integration.service.outcome.ErrorKind;
import com.motif.integration.service.outcome.StageOutcome;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Structured error attached to a run or annotation result.
 *
 * @param stage   stage or branch that failed
 * @param kind    error classification
 * @param message human readable description
 * @param causes  branch errors folded into this one, empty for leaf errors
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PipelineError(
        String stage,
        ErrorKind kind,
        String message,
        List<PipelineError> causes
) {

    public static final String STAGE_VALIDATION = "validation";
    public static final String STAGE_WORKSPACE = "workspace";
    public static final String STAGE_PRIMARY_GRAPH = "primary-graph";
    public static final String STAGE_SECONDARY_GRAPH = "secondary-graph";
    public static final String STAGE_MINING = "mining";
    public static final String STAGE_BRANCHES = "branches";
    public static final String STAGE_READINESS = "readiness";
    public static final String STAGE_ANNOTATION = "annotation";

    public PipelineError {
        causes = causes == null ? List.of() : List.copyOf(causes);
    }

    public static PipelineError of(String stage, ErrorKind kind, String message) {
        return new PipelineError(stage, kind, message, List.of());
    }

    public static PipelineError of(String stage, StageOutcome.Failure<?> failure) {
        return of(stage, failure.kind(), failure.message());
    }

    /**
     * Folds several branch errors into one.
     *
     * The aggregate keeps the shared kind when all causes agree (invalid
     * responses counting as remote errors), otherwise reports REMOTE_ERROR.
     */
    public static PipelineError aggregate(String stage, List<PipelineError> causes) {
        List<ErrorKind> kinds = causes.stream()
                .map(cause -> cause.kind().forAggregation())
                .distinct()
                .toList();
        ErrorKind kind = kinds.size() == 1 ? kinds.get(0) : ErrorKind.REMOTE_ERROR;
        String message = causes.stream()
                .map(cause -> cause.stage() + ": " + cause.message())
                .collect(Collectors.joining("; "));
        return new PipelineError(stage, kind, message, causes);
    }
}
