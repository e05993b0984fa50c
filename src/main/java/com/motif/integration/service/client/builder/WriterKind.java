package com.motif.integration.service.client.builder;

/**
 * Output writer the graph builder is asked to use.
 */
public enum WriterKind {

    /**
     * NetworkX pickle, consumed by the motif miner.
     */
    NETWORKX("networkx", "networkx_graph.pkl"),

    /**
     * Neo4j/Cypher output, consumed by the annotation service.
     */
    NEO4J("neo4j", null);

    private final String wireValue;
    private final String artifactFileName;

    WriterKind(String wireValue, String artifactFileName) {
        this.wireValue = wireValue;
        this.artifactFileName = artifactFileName;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * File name of the artifact inside the job directory, null when the
     * artifact is the directory itself.
     */
    public String artifactFileName() {
        return artifactFileName;
    }
}
