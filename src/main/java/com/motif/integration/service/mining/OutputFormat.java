package com.motif.integration.service.mining;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Form in which the miner reports motifs: one representative pattern per
 * motif, or every matched instance.
 */
public enum OutputFormat {
    REPRESENTATIVE("representative"),
    INSTANCE("instance");

    private final String wireValue;

    OutputFormat(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static OutputFormat fromWire(String value) {
        for (OutputFormat candidate : values()) {
            if (candidate.wireValue.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown OutputFormat: " + value);
    }
}
