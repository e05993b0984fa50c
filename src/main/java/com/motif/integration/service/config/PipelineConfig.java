package com.motif.integration.service.config;

import com.motif.integration.service.mining.GraphKind;
import com.motif.integration.service.mining.OutputFormat;
import com.motif.integration.service.mining.SamplingMethod;
import com.motif.integration.service.mining.SearchStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for the pipeline coordinator and its downstream services.
 *
 * Service URLs are mandatory: a missing URL fails startup instead of surfacing
 * as a runtime error on the first pipeline call.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineConfig {

    /**
     * Downstream service endpoints and timeouts.
     */
    @Valid
    private Services services = new Services();

    /**
     * Readiness check settings.
     */
    @Valid
    private Readiness readiness = new Readiness();

    /**
     * Shared storage and scratch space.
     */
    @Valid
    private Storage storage = new Storage();

    /**
     * Executor sizing for the parallel branch stage.
     */
    @Valid
    private Branches branches = new Branches();

    /**
     * Mining configuration applied when a request does not carry its own.
     */
    @Valid
    private MiningDefaults mining = new MiningDefaults();

    /**
     * Tenant configuration.
     */
    private TenantConfig tenant = new TenantConfig();

    @Getter
    @Setter
    public static class Services {

        @Valid
        private Builder builder = new Builder();

        @Valid
        private Miner miner = new Miner();

        @Valid
        private Annotation annotation = new Annotation();
    }

    @Getter
    @Setter
    public static class Builder {

        /**
         * Base URL of the graph-builder service.
         */
        @NotBlank(message = "pipeline.services.builder.url is required")
        private String url;

        /**
         * Timeout for graph generation calls. Bare numbers are seconds.
         */
        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration timeout = Duration.ofMinutes(30);

        /**
         * Path of the load endpoint.
         */
        private String loadPath = "/api/load";

        /**
         * Path template of the job status endpoint.
         */
        private String statusPath = "/api/job/{jobId}";
    }

    @Getter
    @Setter
    public static class Miner {

        /**
         * Base URL of the motif-miner service.
         */
        @NotBlank(message = "pipeline.services.miner.url is required")
        private String url;

        /**
         * Timeout for mining calls. Bare numbers are seconds.
         */
        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration timeout = Duration.ofMinutes(10);

        /**
         * Path of the mining endpoint.
         */
        private String minePath = "/mine";
    }

    @Getter
    @Setter
    public static class Annotation {

        /**
         * Full URL of the annotation endpoint.
         */
        @NotBlank(message = "pipeline.services.annotation.url is required")
        private String url;

        /**
         * Timeout for annotation calls. Bare numbers are seconds.
         */
        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration timeout = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Readiness {

        /**
         * Timeout of a single status check, kept well below the builder timeout.
         */
        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Storage {

        /**
         * Shared volume where the builder places generated artifacts.
         */
        @NotBlank
        private String sharedOutputPath = "/shared/output";

        /**
         * Root directory for per-run scratch workspaces (empty = system temp dir).
         */
        private String workspaceRoot = "";
    }

    @Getter
    @Setter
    public static class Branches {

        @Positive
        private int coreSize = 4;

        @Positive
        private int maxSize = 16;

        @Positive
        private int queueCapacity = 100;
    }

    @Getter
    @Setter
    public static class MiningDefaults {

        private int minPatternSize = 3;
        private int maxPatternSize = 5;
        private int minNeighborhoodSize = 3;
        private int maxNeighborhoodSize = 5;
        private int neighborhoodCount = 500;
        private int trialCount = 100;

        /**
         * Left unset so the graph kind is derived from the artifact metadata.
         */
        private GraphKind graphKind;

        private SearchStrategy searchStrategy = SearchStrategy.GREEDY;
        private SamplingMethod samplingMethod = SamplingMethod.TREE;
        private OutputFormat outputFormat = OutputFormat.REPRESENTATIVE;
    }

    @Getter
    @Setter
    public static class TenantConfig {

        /**
         * Tenant ID used when a request does not specify one.
         */
        private String defaultTenantId = "default";
    }
}
