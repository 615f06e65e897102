package com.example.cicdbackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CI/CD Backend API.
 *
 * Read-only REST surface over the records a build pipeline writes:
 * - Health / info endpoints for liveness and host resource usage
 * - Approval requests (staging to production gates) with their test and scan summaries
 * - Deployment history per environment, including rollback lineage
 * - Notification log
 *
 * Prometheus metrics are exposed at /metrics through Spring Boot Actuator.
 */
@SpringBootApplication
public class CicdBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(CicdBackendApplication.class, args);
    }
}
