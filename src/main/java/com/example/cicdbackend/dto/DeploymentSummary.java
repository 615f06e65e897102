package com.example.cicdbackend.dto;

import com.example.cicdbackend.domain.Deployment;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * List item of GET /api/v1/deployments.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DeploymentSummary {

    private Long id;
    private String buildNumber;
    private String jobName;
    private Deployment.Environment environment;
    private Deployment.DeploymentStatus status;
    private String versionTag;
    private String deployedBy;
    private Instant startedAt;
    private Instant completedAt;

    @JsonProperty("is_rollback")
    private boolean rollback;

    public static DeploymentSummary from(Deployment deployment) {
        return DeploymentSummary.builder()
                .id(deployment.getId())
                .buildNumber(deployment.getBuildNumber())
                .jobName(deployment.getJobName())
                .environment(deployment.getEnvironment())
                .status(deployment.getStatus())
                .versionTag(deployment.getVersionTag())
                .deployedBy(deployment.getDeployedBy())
                .startedAt(deployment.getStartedAt())
                .completedAt(deployment.getCompletedAt())
                .rollback(Boolean.TRUE.equals(deployment.getRollback()))
                .build();
    }
}
