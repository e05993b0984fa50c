package com.motif.integration.service.aggregate;

import com.motif.integration.service.outcome.ErrorKind;
import com.motif.integration.service.outcome.StageOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class PartialFailureAggregatorTest {

    private ExecutorService executor;
    private PartialFailureAggregator aggregator;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        aggregator = new PartialFailureAggregator(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Outcomes are returned in submission order, not completion order")
    void joinAll_preservesSubmissionOrder() {
        var secondDone = new CountDownLatch(1);

        BranchOutcomes<String, String> outcomes = aggregator.joinAll(
                () -> {
                    await(secondDone);
                    return StageOutcome.success("first");
                },
                () -> {
                    secondDone.countDown();
                    return StageOutcome.success("second");
                });

        assertThat(outcomes.first().value()).contains("first");
        assertThat(outcomes.second().value()).contains("second");
        assertThat(outcomes.allSucceeded()).isTrue();
    }

    @Test
    @DisplayName("A fast failure does not cancel a slow sibling")
    void joinAll_failureDoesNotCancelSibling() {
        var slowFinished = new AtomicBoolean();

        BranchOutcomes<String, Integer> outcomes = aggregator.joinAll(
                () -> StageOutcome.failure(ErrorKind.TIMEOUT, "Timeout connecting to graph builder"),
                () -> {
                    sleep(200);
                    slowFinished.set(true);
                    return StageOutcome.success(42);
                });

        assertThat(slowFinished).isTrue();
        assertThat(outcomes.first().failure()).hasValueSatisfying(f ->
                assertThat(f.kind()).isEqualTo(ErrorKind.TIMEOUT));
        assertThat(outcomes.second().value()).contains(42);
        assertThat(outcomes.allSucceeded()).isFalse();
        assertThat(outcomes.allFailed()).isFalse();
    }

    @Test
    void joinAll_bothFailed() {
        BranchOutcomes<String, String> outcomes = aggregator.joinAll(
                () -> StageOutcome.failure(ErrorKind.TIMEOUT, "a"),
                () -> StageOutcome.failure(ErrorKind.REMOTE_ERROR, "b"));

        assertThat(outcomes.allFailed()).isTrue();
    }

    @Test
    @DisplayName("A branch that throws is recorded as an internal failure")
    void joinAll_thrownExceptionBecomesInternalFailure() {
        BranchOutcomes<String, String> outcomes = aggregator.joinAll(
                () -> {
                    throw new IllegalStateException("boom");
                },
                () -> StageOutcome.success("ok"));

        assertThat(outcomes.first().failure()).hasValueSatisfying(f -> {
            assertThat(f.kind()).isEqualTo(ErrorKind.INTERNAL);
            assertThat(f.message()).contains("boom");
        });
        assertThat(outcomes.second().value()).contains("ok");
    }

    @Test
    void joinAll_rejectedSubmissionBecomesInternalFailure() {
        var saturated = new PartialFailureAggregator(command -> {
            throw new RejectedExecutionException("queue full");
        });

        BranchOutcomes<String, String> outcomes = saturated.joinAll(
                () -> StageOutcome.success("never"),
                () -> StageOutcome.success("never"));

        assertThat(outcomes.allFailed()).isTrue();
        assertThat(outcomes.first().failure()).hasValueSatisfying(f ->
                assertThat(f.kind()).isEqualTo(ErrorKind.INTERNAL));
    }

    private static void await(CountDownLatch latch) {
        try {
            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
