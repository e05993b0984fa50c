package com.motif.integration.service.readiness;

import com.motif.integration.service.client.builder.GraphBuilderClient;
import com.motif.integration.service.client.builder.JobStatus;
import com.motif.integration.service.outcome.ErrorKind;
import com.motif.integration.service.outcome.StageOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

class BuilderReadinessProberTest {

    private GraphBuilderClient graphBuilderClient;
    private BuilderReadinessProber prober;

    @BeforeEach
    void setUp() {
        graphBuilderClient = mock(GraphBuilderClient.class);
        prober = new BuilderReadinessProber(graphBuilderClient);
    }

    @Test
    void completedJobIsReady() {
        when(graphBuilderClient.fetchJobStatus("neo-1"))
                .thenReturn(StageOutcome.success(new JobStatus("neo-1", "completed", null)));

        assertThat(prober.isReady("neo-1")).isTrue();
    }

    @Test
    void processingJobIsNotReadyOnRepeatedChecks() {
        when(graphBuilderClient.fetchJobStatus("neo-1"))
                .thenReturn(StageOutcome.success(new JobStatus("neo-1", "processing", null)));

        assertThat(prober.isReady("neo-1")).isFalse();
        assertThat(prober.isReady("neo-1")).isFalse();

        verify(graphBuilderClient, times(2)).fetchJobStatus("neo-1");
        verifyNoMoreInteractions(graphBuilderClient);
    }

    @Test
    void unreachableBuilderIsNotReady() {
        when(graphBuilderClient.fetchJobStatus("neo-1"))
                .thenReturn(StageOutcome.failure(ErrorKind.TIMEOUT, "Timeout connecting to graph builder"));

        assertThat(prober.isReady("neo-1")).isFalse();
    }

    @Test
    void blankJobIdIsNotReadyWithoutCallingBuilder() {
        assertThat(prober.isReady(" ")).isFalse();
        assertThat(prober.isReady(null)).isFalse();

        verifyNoInteractions(graphBuilderClient);
    }
}
