package com.motif.integration.service.mining;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Neighborhood sampling method used by the miner.
 */
public enum SamplingMethod {
    TREE("tree"),
    RADIAL("radial");

    private final String wireValue;

    SamplingMethod(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static SamplingMethod fromWire(String value) {
        for (SamplingMethod candidate : values()) {
            if (candidate.wireValue.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown SamplingMethod: " + value);
    }
}
