package com.motif.integration.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Motif Integration Service Application - Entry point for the Spring Boot application.
 *
 * This application coordinates three downstream services:
 * - Graph builder: turns CSV input into a NetworkX graph and a Neo4j graph
 * - Motif miner: mines frequent patterns from the NetworkX graph
 * - Annotation service: annotates a user-selected motif against the Neo4j graph
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.motif.integration.service.config")
public class MotifIntegrationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MotifIntegrationServiceApplication.class, args);
    }
}
