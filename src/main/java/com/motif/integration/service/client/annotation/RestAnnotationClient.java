package com.motif.integration.service.client.annotation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.motif.integration.service.client.DownstreamCalls;
import com.motif.integration.service.outcome.StageOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link AnnotationClient} backed by Spring's {@link RestClient}.
 *
 * The configured annotation URL is the full endpoint, not a base URL.
 */
@Slf4j
public class RestAnnotationClient implements AnnotationClient {

    static final String SERVICE_NAME = "annotation service";
    static final String ANNOTATION_TYPE = "cypher";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String endpoint;

    public RestAnnotationClient(RestClient restClient, ObjectMapper objectMapper, String endpoint) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
    }

    @Override
    public StageOutcome<JsonNode> annotate(String correlationId, JsonNode motif) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("correlation_id", correlationId);
        payload.put("type", ANNOTATION_TYPE);
        payload.put("motif", motif);

        log.debug("Sending motif for annotation: correlationId={}", correlationId);
        return DownstreamCalls.execute(SERVICE_NAME,
                () -> DownstreamCalls.exchange(restClient.post()
                        .uri(endpoint)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(payload)),
                response -> DownstreamCalls.readJson(SERVICE_NAME, objectMapper, response));
    }
}
