package com.example.cicdbackend.service;

import com.example.cicdbackend.config.BackendProperties;
import com.example.cicdbackend.domain.Deployment;
import com.example.cicdbackend.dto.DeploymentDetail;
import com.example.cicdbackend.dto.DeploymentSummary;
import com.example.cicdbackend.exception.ResourceNotFoundException;
import com.example.cicdbackend.monitoring.QueryMetrics;
import com.example.cicdbackend.repository.DeploymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to deployment history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DeploymentQueryService {

    private final DeploymentRepository deploymentRepository;
    private final QueryLimits queryLimits;
    private final QueryMetrics queryMetrics;
    private final BackendProperties properties;

    public List<DeploymentSummary> listDeployments(String environment, int limit) {
        Deployment.Environment filter =
                queryLimits.parseFilter(Deployment.Environment.class, "environment", environment);
        int size = queryLimits.cap(limit);
        if (size == 0) return List.of();

        log.debug("Listing deployments environment={} limit={}", filter, size);
        List<Deployment> deployments = queryMetrics.time("list_deployments", () -> filter == null
                ? deploymentRepository.findAllByOrderByStartedAtDescIdDesc(PageRequest.of(0, size))
                : deploymentRepository.findByEnvironmentOrderByStartedAtDescIdDesc(filter, PageRequest.of(0, size)));

        return deployments.stream().map(DeploymentSummary::from).toList();
    }

    public DeploymentDetail getDeployment(Long id) {
        return DeploymentDetail.from(findDeployment(id)
                .orElseThrow(() -> ResourceNotFoundException.deploymentNotFound(id)));
    }

    /**
     * The deployment followed by the deployments it replaced, newest first.
     * Each hop is a separate primary-key lookup; the walk stops at a missing row,
     * at an id already visited, or after the configured maximum depth.
     */
    public List<DeploymentDetail> getLineage(Long id) {
        Deployment current = findDeployment(id)
                .orElseThrow(() -> ResourceNotFoundException.deploymentNotFound(id));

        int maxDepth = properties.getQuery().getMaxLineageDepth();
        List<DeploymentDetail> lineage = new ArrayList<>();
        Set<Long> visited = new HashSet<>();

        while (current != null && visited.add(current.getId()) && lineage.size() < maxDepth) {
            lineage.add(DeploymentDetail.from(current));
            Long previousId = current.getPreviousDeploymentId();
            if (previousId == null) break;

            current = findDeployment(previousId).orElse(null);
            if (current == null) {
                log.warn("Deployment {} references missing previous deployment {}",
                        lineage.get(lineage.size() - 1).getId(), previousId);
            }
        }
        return lineage;
    }

    private Optional<Deployment> findDeployment(Long id) {
        return queryMetrics.time("get_deployment", () -> deploymentRepository.findById(id));
    }
}
