package com.example.cicdbackend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Central configuration for the CI/CD backend.
 * Maps to the 'cicd-backend' prefix in application.yml; environment variables
 * (APP_ENV, HOSTNAME, DATABASE_URL) are wired in through placeholders there.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "cicd-backend")
public class BackendProperties {

    private String appName = "CI/CD Backend API";
    private String version = "1.0.0";
    private String helloMessage = "Hello from Raspberry Pi CI/CD Platform - Automated Deployment!";
    private String helloVersion = "1.0.1";

    /** Name of the deployment environment this process runs in */
    private String environment = "development";

    private String hostname = "unknown";

    /** Raw store connection string; empty when the standard spring.datasource settings apply */
    private String databaseUrl = "";

    private QueryConfig query = new QueryConfig();
    private SystemInfoConfig systemInfo = new SystemInfoConfig();
    private CorsConfig cors = new CorsConfig();

    public boolean isDatabaseConfigured() {
        return databaseUrl != null && !databaseUrl.isBlank();
    }

    @Data
    public static class QueryConfig {
        private int maxLimit = 100;
        private int maxLineageDepth = 50;
    }

    @Data
    public static class SystemInfoConfig {
        /** Window over which CPU utilisation is measured; the info call blocks for this long */
        private Duration cpuSampleInterval = Duration.ofSeconds(1);
        private String diskPath = "/";
    }

    @Data
    public static class CorsConfig {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
