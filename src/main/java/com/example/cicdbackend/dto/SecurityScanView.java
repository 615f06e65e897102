package com.example.cicdbackend.dto;

import com.example.cicdbackend.domain.SecurityScan;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SecurityScanView {

    private Long id;
    private String scanner;
    private int criticalCount;
    private int highCount;
    private int mediumCount;
    private int lowCount;
    private List<Map<String, Object>> vulnerabilities;
    private String reportUrl;
    private Instant scannedAt;

    public static SecurityScanView from(SecurityScan scan) {
        return SecurityScanView.builder()
                .id(scan.getId())
                .scanner(scan.getScanner())
                .criticalCount(count(scan.getCriticalCount()))
                .highCount(count(scan.getHighCount()))
                .mediumCount(count(scan.getMediumCount()))
                .lowCount(count(scan.getLowCount()))
                .vulnerabilities(scan.getVulnerabilities())
                .reportUrl(scan.getReportUrl())
                .scannedAt(scan.getScannedAt())
                .build();
    }

    private static int count(Integer value) {
        return value != null ? value : 0;
    }
}
