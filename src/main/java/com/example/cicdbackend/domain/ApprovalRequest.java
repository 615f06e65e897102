package com.example.cicdbackend.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Gate record for promoting a build from staging to production.
 * Test results, summaries, security scans and deployments point back to it.
 */
@Entity
@Table(name = "approval_requests", indexes = {
        @Index(name = "idx_approval_build_number", columnList = "build_number"),
        @Index(name = "idx_approval_job_name", columnList = "job_name"),
        @Index(name = "idx_approval_requested_at", columnList = "requested_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "build_number", nullable = false, length = 50)
    private String buildNumber;

    @Column(name = "job_name", nullable = false, length = 100)
    private String jobName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ApprovalStatus status = ApprovalStatus.PENDING;

    /** Jenkins user or "system" */
    @Column(name = "requested_by", nullable = false, length = 100)
    private String requestedBy;

    @Column(name = "git_commit", nullable = false, length = 40)
    private String gitCommit;

    @Column(name = "git_branch", nullable = false, length = 100)
    private String gitBranch;

    @Column(name = "version_tag", length = 50)
    private String versionTag;

    @Column(name = "staging_backend_url", length = 500)
    private String stagingBackendUrl;

    @Column(name = "staging_frontend_url", length = 500)
    private String stagingFrontendUrl;

    @Column(name = "staging_api_docs_url", length = 500)
    private String stagingApiDocsUrl;

    @Column(name = "approved_by", length = 100)
    private String approvedBy;

    @Column(name = "approval_notes", columnDefinition = "TEXT")
    private String approvalNotes;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Convert(converter = ManualTestsConverter.class)
    @Column(name = "manual_tests", columnDefinition = "TEXT")
    private List<ManualTestItem> manualTests;

    @Column(name = "requested_at", nullable = false)
    private Instant requestedAt;

    /** Set once, when the request leaves PENDING */
    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    public enum ApprovalStatus implements WireEnum {
        PENDING("pending"),
        APPROVED("approved"),
        REJECTED("rejected"),
        CANCELLED("cancelled");

        private final String value;

        ApprovalStatus(String value) {
            this.value = value;
        }

        @JsonValue
        @Override
        public String getValue() {
            return value;
        }
    }

    @PrePersist
    protected void onCreate() {
        if (requestedAt == null) requestedAt = Instant.now();
        if (status == null) status = ApprovalStatus.PENDING;
    }
}
