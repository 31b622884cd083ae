package dev.campfire;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the Campfire ingestion pipeline.
 *
 * <p>Serves the operator REST API under {@code /api} and the MCP operator tools over SSE on the
 * same port. Background schedulers are switched by {@code campfire.scheduling.enabled}.
 */
@SpringBootApplication
@EnableRetry
@ConfigurationPropertiesScan
public class CampfireApplication {
    public static void main(String[] args) {
        SpringApplication.run(CampfireApplication.class, args);
    }
}
