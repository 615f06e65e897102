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
 * One attempt to deploy a build to staging or production.
 *
 * A rollback points at the deployment it replaces through
 * {@code previousDeploymentId}; the link is resolved by a separate lookup
 * so rollback chains are walked one row at a time.
 */
@Entity
@Table(name = "deployments", indexes = {
        @Index(name = "idx_deployment_build_number", columnList = "build_number"),
        @Index(name = "idx_deployment_job_name", columnList = "job_name"),
        @Index(name = "idx_deployment_started_at", columnList = "started_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Deployment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "build_number", nullable = false, length = 50)
    private String buildNumber;

    @Column(name = "job_name", nullable = false, length = 100)
    private String jobName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Environment environment;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private DeploymentStatus status = DeploymentStatus.PENDING;

    @Column(name = "git_commit", nullable = false, length = 40)
    private String gitCommit;

    @Column(name = "git_branch", nullable = false, length = 100)
    private String gitBranch;

    @Column(name = "version_tag", length = 50)
    private String versionTag;

    /** Docker image tag */
    @Column(name = "image_tag", length = 100)
    private String imageTag;

    @Column(name = "deployed_by", nullable = false, length = 100)
    private String deployedBy;

    @Column(name = "deployment_notes", columnDefinition = "TEXT")
    private String deploymentNotes;

    @Column(name = "is_rollback")
    @Builder.Default
    private Boolean rollback = false;

    @Column(name = "previous_deployment_id")
    private Long previousDeploymentId;

    @Column(name = "backend_url", length = 500)
    private String backendUrl;

    @Column(name = "frontend_url", length = 500)
    private String frontendUrl;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "approval_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private ApprovalRequest approval;

    public enum Environment implements WireEnum {
        STAGING("staging"),
        PRODUCTION("production");

        private final String value;

        Environment(String value) {
            this.value = value;
        }

        @JsonValue
        @Override
        public String getValue() {
            return value;
        }
    }

    public enum DeploymentStatus implements WireEnum {
        PENDING("pending"),
        IN_PROGRESS("in_progress"),
        SUCCESS("success"),
        FAILED("failed"),
        ROLLED_BACK("rolled_back");

        private final String value;

        DeploymentStatus(String value) {
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
        if (startedAt == null) startedAt = Instant.now();
        if (status == null) status = DeploymentStatus.PENDING;
    }
}
