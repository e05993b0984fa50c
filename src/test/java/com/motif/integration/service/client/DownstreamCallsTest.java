package com.motif.integration.service.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.motif.integration.service.outcome.ErrorKind;
import com.motif.integration.service.outcome.StageOutcome;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class DownstreamCallsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void nestedTimeoutIsClassifiedAsTimeout() {
        var error = new ResourceAccessException("I/O error",
                new SocketTimeoutException("Read timed out"));

        StageOutcome<String> outcome = DownstreamCalls.normalize("motif miner", error);

        assertThat(outcome.failure()).hasValueSatisfying(f -> {
            assertThat(f.kind()).isEqualTo(ErrorKind.TIMEOUT);
            assertThat(f.message()).isEqualTo("Timeout connecting to motif miner");
        });
    }

    @Test
    void httpClientTimeoutIsClassifiedAsTimeout() {
        var error = new ResourceAccessException("I/O error", new HttpTimeoutException("request timed out"));

        assertThat(DownstreamCalls.<String>normalize("graph builder", error).failure())
                .hasValueSatisfying(f -> assertThat(f.kind()).isEqualTo(ErrorKind.TIMEOUT));
    }

    @Test
    void connectionFailureIsRemoteError() {
        var error = new ResourceAccessException("Connection refused");

        assertThat(DownstreamCalls.<String>normalize("graph builder", error).failure())
                .hasValueSatisfying(f -> {
                    assertThat(f.kind()).isEqualTo(ErrorKind.REMOTE_ERROR);
                    assertThat(f.message()).contains("Connection refused");
                });
    }

    @Test
    void unexpectedExceptionIsInternal() {
        assertThat(DownstreamCalls.<String>normalize("graph builder", new IllegalStateException("bug")).failure())
                .hasValueSatisfying(f -> assertThat(f.kind()).isEqualTo(ErrorKind.INTERNAL));
    }

    @Test
    void missingRuntimeClassDuringCallIsInternal() {
        StageOutcome<String> outcome = DownstreamCalls.execute("motif miner",
                () -> {
                    throw new NoClassDefFoundError("org/example/Missing");
                },
                response -> StageOutcome.success(response.body()));

        assertThat(outcome.failure()).hasValueSatisfying(f -> {
            assertThat(f.kind()).isEqualTo(ErrorKind.INTERNAL);
            assertThat(f.message()).contains("motif miner", "org/example/Missing");
        });
    }

    @Test
    void nonSuccessStatusIsRemoteErrorWithStatusAndBody() {
        StageOutcome<String> outcome = DownstreamCalls.execute("motif miner",
                () -> new DownstreamResponse(500, "Internal Server Error"),
                response -> StageOutcome.success(response.body()));

        assertThat(outcome.failure()).hasValueSatisfying(f -> {
            assertThat(f.kind()).isEqualTo(ErrorKind.REMOTE_ERROR);
            assertThat(f.message()).isEqualTo("motif miner returned 500: Internal Server Error");
        });
    }

    @Test
    void interpretationErrorIsInvalidResponse() {
        StageOutcome<String> outcome = DownstreamCalls.execute("motif miner",
                () -> new DownstreamResponse(200, "{}"),
                response -> {
                    throw new IllegalStateException("missing field");
                });

        assertThat(outcome.failure()).hasValueSatisfying(f ->
                assertThat(f.kind()).isEqualTo(ErrorKind.INVALID_RESPONSE));
    }

    @Test
    void malformedJsonIsInvalidResponse() {
        var outcome = DownstreamCalls.readJson("annotation service", objectMapper,
                new DownstreamResponse(200, "{not json"));

        assertThat(outcome.failure()).hasValueSatisfying(f ->
                assertThat(f.kind()).isEqualTo(ErrorKind.INVALID_RESPONSE));
    }

    @Test
    void emptyBodyIsInvalidResponse() {
        var outcome = DownstreamCalls.readJson("annotation service", objectMapper,
                new DownstreamResponse(200, ""));

        assertThat(outcome.failure()).hasValueSatisfying(f ->
                assertThat(f.message()).isEqualTo("annotation service returned an empty body"));
    }
}
