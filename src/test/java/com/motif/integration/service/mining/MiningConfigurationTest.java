package com.motif.integration.service.mining;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.motif.integration.service.config.PipelineConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MiningConfigurationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MiningConfiguration defaults() {
        return MiningConfiguration.fromDefaults(new PipelineConfig.MiningDefaults());
    }

    private MiningConfiguration merge(String overrides) throws Exception {
        return objectMapper.readerForUpdating(defaults())
                .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .readValue(overrides);
    }

    @Test
    void snakeCaseOverridesReplaceOnlyTheGivenFields() throws Exception {
        MiningConfiguration merged = merge("{\"min_pattern_size\":4,\"trial_count\":10,\"graph_kind\":\"undirected\"}");

        assertThat(merged.getMinPatternSize()).isEqualTo(4);
        assertThat(merged.getTrialCount()).isEqualTo(10);
        assertThat(merged.getGraphKind()).isEqualTo(GraphKind.UNDIRECTED);
        assertThat(merged.getMaxPatternSize()).isEqualTo(5);
        assertThat(merged.getNeighborhoodCount()).isEqualTo(500);
    }

    @Test
    void camelCaseKeysAreUnknown() {
        assertThatThrownBy(() -> merge("{\"minPatternSize\":4}"))
                .isInstanceOf(UnrecognizedPropertyException.class)
                .hasMessageContaining("minPatternSize");
    }

    @Test
    void enumValuesAcceptWireAndConstantSpelling() throws Exception {
        MiningConfiguration lower = merge("{\"sampling_method\":\"radial\",\"output_format\":\"instance\"}");
        MiningConfiguration upper = merge("{\"sampling_method\":\"RADIAL\",\"output_format\":\"INSTANCE\"}");

        assertThat(lower.getSamplingMethod()).isEqualTo(SamplingMethod.RADIAL);
        assertThat(upper.getSamplingMethod()).isEqualTo(SamplingMethod.RADIAL);
        assertThat(lower.getOutputFormat()).isEqualTo(OutputFormat.INSTANCE);
        assertThat(upper.getOutputFormat()).isEqualTo(OutputFormat.INSTANCE);
    }

    @Test
    void unknownEnumValueIsRejected() {
        assertThatThrownBy(() -> merge("{\"sampling_method\":\"spiral\"}"))
                .hasMessageContaining("Unknown SamplingMethod: spiral");
    }

    @Test
    void serializesWithSnakeCaseKeysAndWireValues() throws Exception {
        String json = objectMapper.writeValueAsString(defaults());

        assertThat(json)
                .contains("\"min_pattern_size\":3")
                .contains("\"sampling_method\":\"tree\"")
                .contains("\"output_format\":\"representative\"")
                .doesNotContain("graph_kind");
    }
}
