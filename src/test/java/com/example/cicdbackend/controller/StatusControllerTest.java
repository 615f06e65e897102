package com.example.cicdbackend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class StatusControllerTest extends AbstractApiTest {

    @Test
    void healthIsAlwaysHealthy() throws Exception {
        JsonNode body = json(perform("/health").andExpect(status().isOk()));

        assertEquals("healthy", body.get("status").asText());
        assertEquals("backend", body.get("service").asText());
        assertNotNull(Instant.parse(body.get("timestamp").asText()));
    }

    @Test
    void rootDescribesTheApi() throws Exception {
        perform("/")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("CI/CD Backend API"))
                .andExpect(jsonPath("$.version").value("1.0.0"))
                .andExpect(jsonPath("$.docs").value("/docs"))
                .andExpect(jsonPath("$.health").value("/health"))
                .andExpect(jsonPath("$.database").value("not_configured"));
    }

    @Test
    void helloReturnsStaticGreeting() throws Exception {
        perform("/api/v1/hello")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Hello from Raspberry Pi CI/CD Platform - Automated Deployment!"))
                .andExpect(jsonPath("$.version").value("1.0.1"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void infoReportsHostUsage() throws Exception {
        JsonNode body = json(perform("/api/v1/info").andExpect(status().isOk()));

        for (String field : new String[]{"cpu_percent", "memory_percent", "disk_percent"}) {
            double value = body.get(field).asDouble();
            assertTrue(value >= 0.0 && value <= 100.0, field + " out of range: " + value);
        }
        assertEquals("test-host", body.get("hostname").asText());
        assertEquals("test", body.get("environment").asText());
    }

    @Test
    void unknownPathKeepsJsonErrorShape() throws Exception {
        perform("/api/v1/nothing-here")
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").exists());
    }
}
