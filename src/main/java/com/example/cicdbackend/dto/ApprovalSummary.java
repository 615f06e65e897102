package com.example.cicdbackend.dto;

import com.example.cicdbackend.domain.ApprovalRequest;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * List item of GET /api/v1/approvals.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ApprovalSummary {

    private Long id;
    private String buildNumber;
    private String jobName;
    private ApprovalRequest.ApprovalStatus status;
    private String gitCommit;
    private Instant requestedAt;
    private String stagingFrontendUrl;
    private String stagingBackendUrl;

    public static ApprovalSummary from(ApprovalRequest approval) {
        return ApprovalSummary.builder()
                .id(approval.getId())
                .buildNumber(approval.getBuildNumber())
                .jobName(approval.getJobName())
                .status(approval.getStatus())
                .gitCommit(approval.getGitCommit())
                .requestedAt(approval.getRequestedAt())
                .stagingFrontendUrl(approval.getStagingFrontendUrl())
                .stagingBackendUrl(approval.getStagingBackendUrl())
                .build();
    }
}
