package com.devpipeline.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * DevPipeline orchestrator.
 *
 * To run against a local PostgreSQL and reasoning service:
 *   DB_URL=jdbc:postgresql://localhost:5432/devpipeline \
 *   WORKER_BASE_URL=http://localhost:8000 mvn -pl orchestrator spring-boot:run
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
