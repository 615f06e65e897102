package com.example.cicdbackend.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Outcome of a single test case within a build.
 */
@Entity
@Table(name = "test_results", indexes = {
        @Index(name = "idx_test_result_build_number", columnList = "build_number"),
        @Index(name = "idx_test_result_job_name", columnList = "job_name")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "build_number", nullable = false, length = 50)
    private String buildNumber;

    @Column(name = "job_name", nullable = false, length = 100)
    private String jobName;

    /** pytest, flutter, e2e, ... */
    @Column(name = "test_suite", nullable = false, length = 100)
    private String testSuite;

    @Column(name = "test_name", nullable = false)
    private String testName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private TestStatus status = TestStatus.PENDING;

    /** Milliseconds */
    private Integer duration;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "stack_trace", columnDefinition = "TEXT")
    private String stackTrace;

    @Column(name = "coverage_percent")
    private Integer coveragePercent;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "approval_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private ApprovalRequest approval;

    public enum TestStatus implements WireEnum {
        PENDING("pending"),
        RUNNING("running"),
        PASSED("passed"),
        FAILED("failed"),
        SKIPPED("skipped"),
        ERROR("error");

        private final String value;

        TestStatus(String value) {
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
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (startedAt == null) startedAt = now;
        if (status == null) status = TestStatus.PENDING;
    }
}
