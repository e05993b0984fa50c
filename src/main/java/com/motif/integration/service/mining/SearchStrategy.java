package com.motif.integration.service.mining;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Motif search strategy used by the miner.
 */
public enum SearchStrategy {
    GREEDY("greedy"),
    MCTS("mcts");

    private final String wireValue;

    SearchStrategy(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static SearchStrategy fromWire(String value) {
        for (SearchStrategy candidate : values()) {
            if (candidate.wireValue.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown SearchStrategy: " + value);
    }
}
