package com.example.cicdbackend.controller;

import com.example.cicdbackend.service.SystemInfoService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness, API info and host resource endpoints.
 */
@RestController
@RequiredArgsConstructor
public class StatusController {

    private final SystemInfoService systemInfoService;

    /**
     * Health check for monitoring; answers 200 as long as the process is up.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(systemInfoService.health());
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(systemInfoService.apiInfo());
    }

    @GetMapping("/api/v1/hello")
    public ResponseEntity<Map<String, Object>> hello() {
        return ResponseEntity.ok(systemInfoService.hello());
    }

    /**
     * CPU, memory and disk utilisation of the host. Takes about a second.
     */
    @GetMapping("/api/v1/info")
    public ResponseEntity<Map<String, Object>> info() {
        return ResponseEntity.ok(systemInfoService.systemInfo());
    }
}
