package com.motif.integration.service.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.motif.integration.service.outcome.ErrorKind;
import com.motif.integration.service.outcome.StageOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Shared call and error-normalization logic for the downstream adapters.
 *
 * Every transport, status and parsing problem is folded into a
 * {@link StageOutcome.Failure}; nothing escapes to the caller. Linkage
 * errors from a missing runtime class are reported as {@code INTERNAL}.
 */
@Slf4j
public final class DownstreamCalls {

    private DownstreamCalls() {
    }

    /**
     * Executes a request without status handling and captures status and body.
     */
    public static DownstreamResponse exchange(RestClient.RequestHeadersSpec<?> spec) {
        return spec.exchange((request, response) -> new DownstreamResponse(
                response.getStatusCode().value(),
                StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8)));
    }

    /**
     * Runs a downstream call and interprets its response.
     *
     * @param service   service name used in messages
     * @param call      performs the HTTP exchange
     * @param onSuccess interprets a 2xx response, validating its shape
     * @return the interpreted outcome or a normalized failure
     */
    public static <T> StageOutcome<T> execute(String service,
                                              Supplier<DownstreamResponse> call,
                                              Function<DownstreamResponse, StageOutcome<T>> onSuccess) {
        DownstreamResponse response;
        try {
            response = call.get();
        } catch (RuntimeException | LinkageError e) {
            return normalize(service, e);
        }

        if (!response.isSuccessful()) {
            log.warn("{} returned status {}", service, response.status());
            return StageOutcome.failure(ErrorKind.REMOTE_ERROR,
                    service + " returned " + response.status() + ": " + response.abbreviatedBody());
        }

        try {
            return onSuccess.apply(response);
        } catch (RuntimeException | LinkageError e) {
            log.warn("Failed to interpret {} response", service, e);
            return StageOutcome.failure(ErrorKind.INVALID_RESPONSE,
                    "Invalid response from " + service + ": " + e.getMessage());
        }
    }

    /**
     * Parses a response body as JSON.
     */
    public static StageOutcome<JsonNode> readJson(String service, ObjectMapper objectMapper,
                                                  DownstreamResponse response) {
        try {
            JsonNode node = objectMapper.readTree(response.body() == null ? "" : response.body());
            if (node == null || node.isMissingNode()) {
                return StageOutcome.failure(ErrorKind.INVALID_RESPONSE, service + " returned an empty body");
            }
            return StageOutcome.success(node);
        } catch (JsonProcessingException e) {
            return StageOutcome.failure(ErrorKind.INVALID_RESPONSE,
                    service + " returned malformed JSON: " + e.getOriginalMessage());
        }
    }

    /**
     * Maps an exception raised by a downstream call to a failure outcome.
     */
    public static <T> StageOutcome<T> normalize(String service, Throwable error) {
        if (isTimeout(error)) {
            log.warn("Timeout calling {}", service);
            return StageOutcome.failure(ErrorKind.TIMEOUT, "Timeout connecting to " + service);
        }
        if (error instanceof RestClientException) {
            log.warn("Failed to reach {}: {}", service, error.getMessage());
            return StageOutcome.failure(ErrorKind.REMOTE_ERROR,
                    "Failed to connect to " + service + ": " + error.getMessage());
        }
        log.error("Unexpected error calling {}", service, error);
        return StageOutcome.failure(ErrorKind.INTERNAL,
                "Unexpected error calling " + service + ": " + error.getMessage());
    }

    static boolean isTimeout(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof SocketTimeoutException
                    || current instanceof HttpTimeoutException
                    || current instanceof TimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
