package com.motif.integration.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.motif.integration.service.client.annotation.AnnotationClient;
import com.motif.integration.service.client.annotation.RestAnnotationClient;
import com.motif.integration.service.client.builder.ArtifactLocator;
import com.motif.integration.service.client.builder.GraphBuilderClient;
import com.motif.integration.service.client.builder.RestGraphBuilderClient;
import com.motif.integration.service.client.miner.MinerClient;
import com.motif.integration.service.client.miner.RestMinerClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Configuration for the downstream service adapters.
 *
 * Each adapter gets its own {@link RestClient} so that its timeout applies to
 * that service only. Clients are plain beans injected into the coordinator.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ClientConfig {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final PipelineConfig pipelineConfig;

    /**
     * Resolves artifact locations on the shared output volume.
     */
    @Bean
    public ArtifactLocator artifactLocator() {
        return new ArtifactLocator(pipelineConfig.getStorage().getSharedOutputPath());
    }

    /**
     * Graph-builder adapter: long timeout for load, readiness timeout for status.
     */
    @Bean
    public GraphBuilderClient graphBuilderClient(RestClient.Builder restClientBuilder,
                                                 ObjectMapper objectMapper,
                                                 ArtifactLocator artifactLocator) {
        var settings = pipelineConfig.getServices().getBuilder();
        log.info("Initializing graph builder client: {} (timeout={}, status timeout={})",
                settings.getUrl(), settings.getTimeout(), pipelineConfig.getReadiness().getTimeout());

        RestClient loadClient = restClientBuilder.clone()
                .baseUrl(settings.getUrl())
                .requestFactory(requestFactory(settings.getTimeout()))
                .build();
        RestClient statusClient = restClientBuilder.clone()
                .baseUrl(settings.getUrl())
                .requestFactory(requestFactory(pipelineConfig.getReadiness().getTimeout()))
                .build();

        return new RestGraphBuilderClient(loadClient, statusClient, objectMapper, artifactLocator,
                settings.getLoadPath(), settings.getStatusPath());
    }

    /**
     * Motif-miner adapter.
     */
    @Bean
    public MinerClient minerClient(RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        var settings = pipelineConfig.getServices().getMiner();
        log.info("Initializing miner client: {} (timeout={})", settings.getUrl(), settings.getTimeout());

        RestClient restClient = restClientBuilder.clone()
                .baseUrl(settings.getUrl())
                .requestFactory(requestFactory(settings.getTimeout()))
                .build();
        return new RestMinerClient(restClient, objectMapper, settings.getMinePath());
    }

    /**
     * Annotation adapter.
     */
    @Bean
    public AnnotationClient annotationClient(RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        var settings = pipelineConfig.getServices().getAnnotation();
        log.info("Initializing annotation client: {} (timeout={})", settings.getUrl(), settings.getTimeout());

        RestClient restClient = restClientBuilder.clone()
                .requestFactory(requestFactory(settings.getTimeout()))
                .build();
        return new RestAnnotationClient(restClient, objectMapper, settings.getUrl());
    }

    private ClientHttpRequestFactory requestFactory(Duration readTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .build();
        var factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(readTimeout);
        return factory;
    }
}
