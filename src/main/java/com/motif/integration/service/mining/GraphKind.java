package com.motif.integration.service.mining;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of graph stored in a generated artifact.
 */
public enum GraphKind {
    DIRECTED("directed"),
    UNDIRECTED("undirected");

    private final String wireValue;

    GraphKind(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static GraphKind fromWire(String value) {
        for (GraphKind candidate : values()) {
            if (candidate.wireValue.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown GraphKind: " + value);
    }
}
