package com.motif.integration.service.mining;

import com.motif.integration.service.config.PipelineConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MiningRequestValidatorTest {

    private final MiningRequestValidator validator = new MiningRequestValidator();

    private MiningConfiguration defaults() {
        return MiningConfiguration.fromDefaults(new PipelineConfig.MiningDefaults());
    }

    @Test
    void defaultConfigurationIsValid() {
        assertThat(validator.validate(defaults())).isEmpty();
    }

    @Test
    void minPatternSizeAboveMaxIsRejected() {
        var configuration = defaults().toBuilder()
                .minPatternSize(10)
                .maxPatternSize(5)
                .build();

        List<String> violations = validator.validate(configuration);

        assertThat(violations).singleElement().asString()
                .contains("pattern size min must not exceed max")
                .contains("min=10")
                .contains("max=5");
    }

    @Test
    void nonPositiveValuesAreRejected() {
        var configuration = defaults().toBuilder()
                .minNeighborhoodSize(0)
                .neighborhoodCount(-1)
                .trialCount(0)
                .build();

        assertThat(validator.validate(configuration)).hasSize(3);
    }

    @Test
    void missingEnumsAreRejected() {
        var configuration = defaults().toBuilder()
                .searchStrategy(null)
                .outputFormat(null)
                .build();

        assertThat(validator.validate(configuration))
                .containsExactly("search strategy is required", "output format is required");
    }

    @Test
    void missingGraphKindIsAllowed() {
        var configuration = defaults().toBuilder().graphKind(null).build();

        assertThat(validator.validate(configuration)).isEmpty();
    }

    @Test
    void nullConfigurationIsRejected() {
        assertThat(validator.validate(null)).containsExactly("mining configuration is required");
    }
}
