package com.example.cicdbackend.service;

import com.example.cicdbackend.config.BackendProperties;
import com.example.cicdbackend.monitoring.HostResourceSampler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and host information. Never touches the store.
 */
@Service
@RequiredArgsConstructor
public class SystemInfoService {

    static final String SERVICE_NAME = "backend";

    private final BackendProperties properties;
    private final HostResourceSampler sampler;

    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        health.put("timestamp", Instant.now());
        health.put("service", SERVICE_NAME);
        return health;
    }

    /** Blocks for the CPU sampling window (one second by default). */
    public Map<String, Object> systemInfo() {
        HostResourceSampler.HostUsage usage = sampler.sample();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("cpu_percent", usage.cpuPercent());
        info.put("memory_percent", usage.memoryPercent());
        info.put("disk_percent", usage.diskPercent());
        info.put("hostname", properties.getHostname());
        info.put("environment", properties.getEnvironment());
        return info;
    }

    public Map<String, Object> apiInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.getAppName());
        info.put("version", properties.getVersion());
        info.put("docs", "/docs");
        info.put("health", "/health");
        info.put("database", properties.isDatabaseConfigured() ? "configured" : "not_configured");
        return info;
    }

    public Map<String, Object> hello() {
        Map<String, Object> hello = new LinkedHashMap<>();
        hello.put("message", properties.getHelloMessage());
        hello.put("version", properties.getHelloVersion());
        hello.put("timestamp", Instant.now());
        return hello;
    }
}
