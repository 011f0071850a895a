package com.worldmaker.core.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * WorldMaker Core Service Application - Entry point for the Spring Boot application.
 *
 * This application hosts the dependency graph and synthetic trace engines:
 * - Records service dependencies and flags the edges that close a cycle
 * - Answers transitive, blast-radius and failure-impact queries
 * - Synthesizes OpenTelemetry/Jaeger traces for registered flows
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan("com.worldmaker.core.service.config")
public class WorldmakerCoreServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorldmakerCoreServiceApplication.class, args);
    }
}
