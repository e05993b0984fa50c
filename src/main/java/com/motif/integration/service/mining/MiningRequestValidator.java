package com.motif.integration.service.mining;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks mining parameters before anything is dispatched to the miner.
 */
@Slf4j
@Component
public class MiningRequestValidator {

    /**
     * Validates a mining configuration.
     *
     * @param configuration the configuration to check
     * @return human readable violations, empty when valid
     */
    public List<String> validate(MiningConfiguration configuration) {
        if (configuration == null) {
            return List.of("mining configuration is required");
        }

        var violations = new ArrayList<String>();
        checkBounds(violations, "pattern size",
                configuration.getMinPatternSize(), configuration.getMaxPatternSize());
        checkBounds(violations, "neighborhood size",
                configuration.getMinNeighborhoodSize(), configuration.getMaxNeighborhoodSize());
        checkPositive(violations, "neighborhood count", configuration.getNeighborhoodCount());
        checkPositive(violations, "trial count", configuration.getTrialCount());
        checkPresent(violations, "search strategy", configuration.getSearchStrategy());
        checkPresent(violations, "sampling method", configuration.getSamplingMethod());
        checkPresent(violations, "output format", configuration.getOutputFormat());

        if (!violations.isEmpty()) {
            log.debug("Mining configuration rejected: {}", violations);
        }
        return violations;
    }

    private void checkBounds(List<String> violations, String name, int min, int max) {
        if (min <= 0 || max <= 0) {
            violations.add(name + " bounds must be positive (min=" + min + ", max=" + max + ")");
        } else if (min > max) {
            violations.add(name + " min must not exceed max (min=" + min + ", max=" + max + ")");
        }
    }

    private void checkPositive(List<String> violations, String name, int value) {
        if (value <= 0) {
            violations.add(name + " must be positive (was " + value + ")");
        }
    }

    private void checkPresent(List<String> violations, String name, Object value) {
        if (value == null) {
            violations.add(name + " is required");
        }
    }
}
