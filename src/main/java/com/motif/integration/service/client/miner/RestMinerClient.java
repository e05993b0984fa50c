package com.motif.integration.service.client.miner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.motif.integration.service.client.DownstreamCalls;
import com.motif.integration.service.client.DownstreamResponse;
import com.motif.integration.service.mining.MiningConfiguration;
import com.motif.integration.service.outcome.ErrorKind;
import com.motif.integration.service.outcome.StageOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.nio.file.Files;
import java.util.ArrayList;

/**
 * {@link MinerClient} backed by Spring's {@link RestClient}.
 *
 * A response is only accepted when {@code motifs} is an array and
 * {@code statistics} is present.
 */
@Slf4j
public class RestMinerClient implements MinerClient {

    static final String SERVICE_NAME = "motif miner";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String minePath;

    public RestMinerClient(RestClient restClient, ObjectMapper objectMapper, String minePath) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.minePath = minePath;
    }

    @Override
    public StageOutcome<MiningResult> mine(MiningJob job) {
        if (!Files.isRegularFile(job.artifactPath())) {
            log.warn("Graph artifact not found: {}", job.artifactPath());
            return StageOutcome.failure(ErrorKind.REMOTE_ERROR,
                    "Graph artifact not found: " + job.artifactPath());
        }

        log.debug("Mining artifact {} with {}", job.artifactPath(), job.configuration());
        return DownstreamCalls.execute(SERVICE_NAME,
                () -> DownstreamCalls.exchange(restClient.post()
                        .uri(minePath)
                        .contentType(MediaType.MULTIPART_FORM_DATA)
                        .body(buildMultipartBody(job))),
                this::toMiningResult);
    }

    private MultiValueMap<String, Object> buildMultipartBody(MiningJob job) {
        MiningConfiguration config = job.configuration();
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new FileSystemResource(job.artifactPath()));
        body.add("min_pattern_size", String.valueOf(config.getMinPatternSize()));
        body.add("max_pattern_size", String.valueOf(config.getMaxPatternSize()));
        body.add("min_neighborhood_size", String.valueOf(config.getMinNeighborhoodSize()));
        body.add("max_neighborhood_size", String.valueOf(config.getMaxNeighborhoodSize()));
        body.add("n_neighborhoods", String.valueOf(config.getNeighborhoodCount()));
        body.add("n_trials", String.valueOf(config.getTrialCount()));
        body.add("graph_type", config.getGraphKind().wireValue());
        body.add("search_strategy", config.getSearchStrategy().wireValue());
        body.add("sample_method", config.getSamplingMethod().wireValue());
        body.add("output_format", config.getOutputFormat().wireValue());
        return body;
    }

    private StageOutcome<MiningResult> toMiningResult(DownstreamResponse response) {
        return DownstreamCalls.readJson(SERVICE_NAME, objectMapper, response)
                .flatMap(json -> {
                    JsonNode motifs = json.get("motifs");
                    JsonNode statistics = json.get("statistics");
                    if (motifs == null || !motifs.isArray() || statistics == null || statistics.isNull()) {
                        log.warn("Invalid motif output structure from miner: {}", response.abbreviatedBody());
                        return StageOutcome.failure(ErrorKind.INVALID_RESPONSE,
                                "Invalid motif output structure from miner: " + response.abbreviatedBody());
                    }

                    var motifList = new ArrayList<JsonNode>(motifs.size());
                    motifs.forEach(motifList::add);
                    log.info("Miner returned {} motifs", motifList.size());
                    return StageOutcome.success(new MiningResult(motifList, statistics));
                });
    }
}
