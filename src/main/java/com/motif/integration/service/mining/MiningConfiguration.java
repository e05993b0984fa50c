package com.motif.integration.service.mining;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.motif.integration.service.config.PipelineConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parameters for one mining call.
 *
 * A null {@code graphKind} means "derive it from the artifact metadata".
 * On the wire properties are snake_case, e.g. {@code min_pattern_size}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MiningConfiguration {

    private int minPatternSize;
    private int maxPatternSize;
    private int minNeighborhoodSize;
    private int maxNeighborhoodSize;
    private int neighborhoodCount;
    private int trialCount;
    private GraphKind graphKind;
    private SearchStrategy searchStrategy;
    private SamplingMethod samplingMethod;
    private OutputFormat outputFormat;

    /**
     * Builds the configuration used when a request does not carry one.
     */
    public static MiningConfiguration fromDefaults(PipelineConfig.MiningDefaults defaults) {
        return MiningConfiguration.builder()
                .minPatternSize(defaults.getMinPatternSize())
                .maxPatternSize(defaults.getMaxPatternSize())
                .minNeighborhoodSize(defaults.getMinNeighborhoodSize())
                .maxNeighborhoodSize(defaults.getMaxNeighborhoodSize())
                .neighborhoodCount(defaults.getNeighborhoodCount())
                .trialCount(defaults.getTrialCount())
                .graphKind(defaults.getGraphKind())
                .searchStrategy(defaults.getSearchStrategy())
                .samplingMethod(defaults.getSamplingMethod())
                .outputFormat(defaults.getOutputFormat())
                .build();
    }

    public boolean hasGraphKind() {
        return graphKind != null;
    }
}
