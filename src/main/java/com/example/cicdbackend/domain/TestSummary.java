package com.example.cicdbackend.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Aggregated test counts for one build. The counts are written by the
 * pipeline as-is; total_tests is not checked against the per-outcome counts.
 */
@Entity
@Table(name = "test_summaries", indexes = {
        @Index(name = "idx_test_summary_build_number", columnList = "build_number"),
        @Index(name = "idx_test_summary_job_name", columnList = "job_name")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestSummary {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "build_number", nullable = false, length = 50)
    private String buildNumber;

    @Column(name = "job_name", nullable = false, length = 100)
    private String jobName;

    @Column(name = "total_tests")
    @Builder.Default
    private Integer totalTests = 0;

    @Column(name = "passed_tests")
    @Builder.Default
    private Integer passedTests = 0;

    @Column(name = "failed_tests")
    @Builder.Default
    private Integer failedTests = 0;

    @Column(name = "skipped_tests")
    @Builder.Default
    private Integer skippedTests = 0;

    @Column(name = "error_tests")
    @Builder.Default
    private Integer errorTests = 0;

    @Column(name = "overall_coverage")
    private Integer overallCoverage;

    /** Milliseconds */
    @Column(name = "total_duration")
    private Integer totalDuration;

    @Column(name = "html_report_url", length = 500)
    private String htmlReportUrl;

    @Column(name = "allure_report_url", length = 500)
    private String allureReportUrl;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "approval_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private ApprovalRequest approval;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
