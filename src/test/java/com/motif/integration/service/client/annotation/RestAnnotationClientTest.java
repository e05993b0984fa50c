package com.motif.integration.service.client.annotation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.motif.integration.service.outcome.ErrorKind;
import com.motif.integration.service.outcome.StageOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestAnnotationClientTest {

    private static final String ENDPOINT = "http://annotation-service:6000/annotate";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockRestServiceServer server;
    private RestAnnotationClient client;
    private JsonNode motif;

    @BeforeEach
    void setUp() throws Exception {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new RestAnnotationClient(builder.build(), objectMapper, ENDPOINT);
        motif = objectMapper.readTree("{\"nodes\":[\"a\",\"b\"],\"edges\":[[\"a\",\"b\"]]}");
    }

    @Test
    void annotate_postsCypherRequestAndPassesResponseThrough() {
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.correlation_id").value("neo-1"))
                .andExpect(jsonPath("$.type").value("cypher"))
                .andExpect(jsonPath("$.motif.nodes[1]").value("b"))
                .andRespond(withSuccess("{\"query\":\"MATCH (a)-->(b) RETURN a, b\",\"summary\":\"pair\"}",
                        MediaType.APPLICATION_JSON));

        StageOutcome<JsonNode> outcome = client.annotate("neo-1", motif);

        server.verify();
        assertThat(outcome.value()).hasValueSatisfying(annotation ->
                assertThat(annotation.get("summary").asText()).isEqualTo("pair"));
    }

    @Test
    void annotate_badGatewayIsRemoteError() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY).body("upstream down"));

        assertThat(client.annotate("neo-1", motif).failure()).hasValueSatisfying(f -> {
            assertThat(f.kind()).isEqualTo(ErrorKind.REMOTE_ERROR);
            assertThat(f.message()).isEqualTo("annotation service returned 502: upstream down");
        });
    }

    @Test
    void annotate_nonJsonBodyIsInvalidResponse() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("<html>oops</html>", MediaType.TEXT_HTML));

        assertThat(client.annotate("neo-1", motif).failure()).hasValueSatisfying(f ->
                assertThat(f.kind()).isEqualTo(ErrorKind.INVALID_RESPONSE));
    }
}
