package com.example.cicdbackend.dto;

import com.example.cicdbackend.domain.TestResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TestResultView {

    private Long id;
    private String testSuite;
    private String testName;
    private TestResult.TestStatus status;
    private Integer duration;
    private String errorMessage;
    private Integer coveragePercent;
    private Instant startedAt;
    private Instant completedAt;

    public static TestResultView from(TestResult result) {
        return TestResultView.builder()
                .id(result.getId())
                .testSuite(result.getTestSuite())
                .testName(result.getTestName())
                .status(result.getStatus())
                .duration(result.getDuration())
                .errorMessage(result.getErrorMessage())
                .coveragePercent(result.getCoveragePercent())
                .startedAt(result.getStartedAt())
                .completedAt(result.getCompletedAt())
                .build();
    }
}
