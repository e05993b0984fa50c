package com.motif.integration.service.aggregate;

import com.motif.integration.service.outcome.ErrorKind;
import com.motif.integration.service.outcome.StageOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs independent operations concurrently and collects every outcome.
 *
 * Never short-circuits: a failing operation does not cancel its siblings, and
 * the join waits until every operation is terminal. Outcomes are returned in
 * submission order regardless of completion order.
 */
@Slf4j
@Component
public class PartialFailureAggregator {

    private final Executor branchExecutor;

    public PartialFailureAggregator(@Qualifier("branchExecutor") Executor branchExecutor) {
        this.branchExecutor = branchExecutor;
    }

    /**
     * Runs two operations of different result types concurrently.
     */
    public <A, B> BranchOutcomes<A, B> joinAll(Supplier<StageOutcome<A>> first,
                                               Supplier<StageOutcome<B>> second) {
        CompletableFuture<StageOutcome<A>> firstFuture = launch(first);
        CompletableFuture<StageOutcome<B>> secondFuture = launch(second);

        CompletableFuture.allOf(firstFuture, secondFuture).join();
        return new BranchOutcomes<>(firstFuture.join(), secondFuture.join());
    }

    // ==================== Helper Methods ====================

    /**
     * Starts an operation whose future always completes normally.
     */
    private <T> CompletableFuture<StageOutcome<T>> launch(Supplier<StageOutcome<T>> operation) {
        try {
            return CompletableFuture.supplyAsync(operation, branchExecutor)
                    .exceptionally(this::captureFailure);
        } catch (RejectedExecutionException e) {
            log.error("Branch executor rejected operation", e);
            return CompletableFuture.completedFuture(
                    StageOutcome.failure(ErrorKind.INTERNAL, "Branch rejected: executor saturated"));
        }
    }

    private <T> StageOutcome<T> captureFailure(Throwable error) {
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        log.error("Branch raised instead of returning an outcome", cause);
        return StageOutcome.failure(ErrorKind.INTERNAL, "Branch failed unexpectedly: " + cause.getMessage());
    }
}
