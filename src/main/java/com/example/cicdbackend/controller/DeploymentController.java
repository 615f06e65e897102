package com.example.cicdbackend.controller;

import com.example.cicdbackend.dto.DeploymentDetail;
import com.example.cicdbackend.dto.DeploymentSummary;
import com.example.cicdbackend.service.DeploymentQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Deployment History REST API Controller.
 */
@RestController
@RequestMapping("/api/v1/deployments")
@RequiredArgsConstructor
public class DeploymentController {

    private final DeploymentQueryService deploymentService;

    /**
     * List deployments, most recently started first.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listDeployments(
            @RequestParam(required = false) String environment,
            @RequestParam(defaultValue = "20") int limit) {
        List<DeploymentSummary> deployments = deploymentService.listDeployments(environment, limit);
        return ResponseEntity.ok(Map.of(
                "count", deployments.size(),
                "deployments", deployments
        ));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DeploymentDetail> getDeployment(@PathVariable Long id) {
        return ResponseEntity.ok(deploymentService.getDeployment(id));
    }

    /**
     * Rollback lineage: the deployment and the chain of deployments it replaced.
     */
    @GetMapping("/{id}/lineage")
    public ResponseEntity<Map<String, Object>> getLineage(@PathVariable Long id) {
        List<DeploymentDetail> lineage = deploymentService.getLineage(id);
        return ResponseEntity.ok(Map.of(
                "deployment_id", id,
                "depth", lineage.size(),
                "lineage", lineage
        ));
    }
}
