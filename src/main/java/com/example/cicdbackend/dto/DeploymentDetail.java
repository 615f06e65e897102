package com.example.cicdbackend.dto;

import com.example.cicdbackend.domain.Deployment;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DeploymentDetail {

    private Long id;
    private String buildNumber;
    private String jobName;
    private Deployment.Environment environment;
    private Deployment.DeploymentStatus status;
    private String gitCommit;
    private String gitBranch;
    private String versionTag;
    private String imageTag;
    private String deployedBy;
    private String deploymentNotes;

    @JsonProperty("is_rollback")
    private boolean rollback;

    private Long previousDeploymentId;
    private String backendUrl;
    private String frontendUrl;
    private Instant startedAt;
    private Instant completedAt;
    private Long approvalId;

    public static DeploymentDetail from(Deployment deployment) {
        return DeploymentDetail.builder()
                .id(deployment.getId())
                .buildNumber(deployment.getBuildNumber())
                .jobName(deployment.getJobName())
                .environment(deployment.getEnvironment())
                .status(deployment.getStatus())
                .gitCommit(deployment.getGitCommit())
                .gitBranch(deployment.getGitBranch())
                .versionTag(deployment.getVersionTag())
                .imageTag(deployment.getImageTag())
                .deployedBy(deployment.getDeployedBy())
                .deploymentNotes(deployment.getDeploymentNotes())
                .rollback(Boolean.TRUE.equals(deployment.getRollback()))
                .previousDeploymentId(deployment.getPreviousDeploymentId())
                .backendUrl(deployment.getBackendUrl())
                .frontendUrl(deployment.getFrontendUrl())
                .startedAt(deployment.getStartedAt())
                .completedAt(deployment.getCompletedAt())
                .approvalId(deployment.getApproval() != null ? deployment.getApproval().getId() : null)
                .build();
    }
}
