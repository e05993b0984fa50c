package com.motif.integration.service.outcome;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageOutcomeTest {

    @Test
    void successExposesValueAndNoFailure() {
        StageOutcome<String> outcome = StageOutcome.success("job-1");

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.value()).contains("job-1");
        assertThat(outcome.failure()).isEmpty();
    }

    @Test
    void failureExposesKindAndMessage() {
        StageOutcome<String> outcome = StageOutcome.failure(ErrorKind.TIMEOUT, "Timeout connecting to miner");

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.value()).isEmpty();
        assertThat(outcome.failure()).hasValueSatisfying(failure -> {
            assertThat(failure.kind()).isEqualTo(ErrorKind.TIMEOUT);
            assertThat(failure.message()).isEqualTo("Timeout connecting to miner");
        });
    }

    @Test
    void flatMapSkipsNextStageOnFailure() {
        var invoked = new AtomicBoolean();
        StageOutcome<String> failed = StageOutcome.failure(ErrorKind.REMOTE_ERROR, "builder returned 500");

        StageOutcome<Integer> chained = failed.flatMap(value -> {
            invoked.set(true);
            return StageOutcome.success(value.length());
        });

        assertThat(invoked).isFalse();
        assertThat(chained.failure()).hasValueSatisfying(failure ->
                assertThat(failure.kind()).isEqualTo(ErrorKind.REMOTE_ERROR));
    }

    @Test
    void mapAndFlatMapChainSuccesses() {
        StageOutcome<Integer> outcome = StageOutcome.success("motif")
                .map(String::length)
                .flatMap(length -> StageOutcome.success(length * 2));

        assertThat(outcome.value()).contains(10);
    }

    @Test
    void failureRequiresKind() {
        assertThatThrownBy(() -> StageOutcome.failure(null, "no kind"))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void invalidResponseAggregatesAsRemoteError() {
        assertThat(ErrorKind.INVALID_RESPONSE.forAggregation()).isEqualTo(ErrorKind.REMOTE_ERROR);
        assertThat(ErrorKind.TIMEOUT.forAggregation()).isEqualTo(ErrorKind.TIMEOUT);
    }
}
