package com.example.cicdbackend.controller;

import com.example.cicdbackend.dto.ApprovalDetail;
import com.example.cicdbackend.dto.ApprovalSummary;
import com.example.cicdbackend.dto.TestResultView;
import com.example.cicdbackend.service.ApprovalQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Approval Request REST API Controller.
 */
@RestController
@RequestMapping("/api/v1/approvals")
@RequiredArgsConstructor
public class ApprovalController {

    private final ApprovalQueryService approvalService;

    /**
     * List approval requests, newest first.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listApprovals(
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "10") int limit) {
        List<ApprovalSummary> approvals = approvalService.listApprovals(status, limit);
        return ResponseEntity.ok(Map.of(
                "count", approvals.size(),
                "approvals", approvals
        ));
    }

    /**
     * Get one approval with its latest test summary and security scan.
     */
    @GetMapping("/{id}")
    public ResponseEntity<ApprovalDetail> getApproval(@PathVariable Long id) {
        return ResponseEntity.ok(approvalService.getApproval(id));
    }

    @GetMapping("/{id}/test-results")
    public ResponseEntity<Map<String, Object>> getTestResults(@PathVariable Long id) {
        List<TestResultView> results = approvalService.getTestResults(id);
        return ResponseEntity.ok(Map.of(
                "approval_id", id,
                "count", results.size(),
                "test_results", results
        ));
    }
}
