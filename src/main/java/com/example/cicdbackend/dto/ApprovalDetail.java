package com.example.cicdbackend.dto;

import com.example.cicdbackend.domain.ApprovalRequest;
import com.example.cicdbackend.domain.ManualTestItem;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Full view of one approval request. {@code testSummary} and {@code securityScan}
 * hold the latest associated rows and stay null when the pipeline recorded none.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ApprovalDetail {

    private Long id;
    private String buildNumber;
    private String jobName;
    private ApprovalRequest.ApprovalStatus status;
    private String requestedBy;
    private String gitCommit;
    private String gitBranch;
    private String versionTag;
    private String stagingBackendUrl;
    private String stagingFrontendUrl;
    private String stagingApiDocsUrl;
    private String approvedBy;
    private String approvalNotes;
    private String rejectionReason;
    private List<ManualTestItem> manualTests;
    private Instant requestedAt;
    private Instant reviewedAt;
    private TestSummaryView testSummary;
    private SecurityScanView securityScan;

    public static ApprovalDetail from(ApprovalRequest approval,
                                      TestSummaryView testSummary,
                                      SecurityScanView securityScan) {
        return ApprovalDetail.builder()
                .id(approval.getId())
                .buildNumber(approval.getBuildNumber())
                .jobName(approval.getJobName())
                .status(approval.getStatus())
                .requestedBy(approval.getRequestedBy())
                .gitCommit(approval.getGitCommit())
                .gitBranch(approval.getGitBranch())
                .versionTag(approval.getVersionTag())
                .stagingBackendUrl(approval.getStagingBackendUrl())
                .stagingFrontendUrl(approval.getStagingFrontendUrl())
                .stagingApiDocsUrl(approval.getStagingApiDocsUrl())
                .approvedBy(approval.getApprovedBy())
                .approvalNotes(approval.getApprovalNotes())
                .rejectionReason(approval.getRejectionReason())
                .manualTests(approval.getManualTests())
                .requestedAt(approval.getRequestedAt())
                .reviewedAt(approval.getReviewedAt())
                .testSummary(testSummary)
                .securityScan(securityScan)
                .build();
    }
}
