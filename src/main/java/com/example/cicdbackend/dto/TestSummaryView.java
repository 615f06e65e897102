package com.example.cicdbackend.dto;

import com.example.cicdbackend.domain.TestSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TestSummaryView {

    private Long id;
    private int totalTests;
    private int passedTests;
    private int failedTests;
    private int skippedTests;
    private int errorTests;
    private Integer overallCoverage;
    private Integer totalDuration;
    private String htmlReportUrl;
    private String allureReportUrl;
    private Instant createdAt;

    public static TestSummaryView from(TestSummary summary) {
        return TestSummaryView.builder()
                .id(summary.getId())
                .totalTests(count(summary.getTotalTests()))
                .passedTests(count(summary.getPassedTests()))
                .failedTests(count(summary.getFailedTests()))
                .skippedTests(count(summary.getSkippedTests()))
                .errorTests(count(summary.getErrorTests()))
                .overallCoverage(summary.getOverallCoverage())
                .totalDuration(summary.getTotalDuration())
                .htmlReportUrl(summary.getHtmlReportUrl())
                .allureReportUrl(summary.getAllureReportUrl())
                .createdAt(summary.getCreatedAt())
                .build();
    }

    /** Rows written outside this service may leave a count NULL. */
    private static int count(Integer value) {
        return value != null ? value : 0;
    }
}
