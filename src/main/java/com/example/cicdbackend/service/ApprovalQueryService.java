package com.example.cicdbackend.service;

import com.example.cicdbackend.domain.ApprovalRequest;
import com.example.cicdbackend.dto.ApprovalDetail;
import com.example.cicdbackend.dto.ApprovalSummary;
import com.example.cicdbackend.dto.SecurityScanView;
import com.example.cicdbackend.dto.TestResultView;
import com.example.cicdbackend.dto.TestSummaryView;
import com.example.cicdbackend.exception.ResourceNotFoundException;
import com.example.cicdbackend.monitoring.QueryMetrics;
import com.example.cicdbackend.repository.ApprovalRequestRepository;
import com.example.cicdbackend.repository.SecurityScanRepository;
import com.example.cicdbackend.repository.TestResultRepository;
import com.example.cicdbackend.repository.TestSummaryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read access to approval requests and the test / security records attached to them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ApprovalQueryService {

    private final ApprovalRequestRepository approvalRepository;
    private final TestSummaryRepository testSummaryRepository;
    private final SecurityScanRepository securityScanRepository;
    private final TestResultRepository testResultRepository;
    private final QueryLimits queryLimits;
    private final QueryMetrics queryMetrics;

    /**
     * Approvals newest first, optionally restricted to one status.
     * An empty store or an unmatched filter yields an empty list.
     */
    public List<ApprovalSummary> listApprovals(String status, int limit) {
        ApprovalRequest.ApprovalStatus filter =
                queryLimits.parseFilter(ApprovalRequest.ApprovalStatus.class, "status", status);
        int size = queryLimits.cap(limit);
        if (size == 0) return List.of();

        log.debug("Listing approvals status={} limit={}", filter, size);
        List<ApprovalRequest> approvals = queryMetrics.time("list_approvals", () -> filter == null
                ? approvalRepository.findAllByOrderByRequestedAtDescIdDesc(PageRequest.of(0, size))
                : approvalRepository.findByStatusOrderByRequestedAtDescIdDesc(filter, PageRequest.of(0, size)));

        return approvals.stream().map(ApprovalSummary::from).toList();
    }

    /**
     * One approval with its latest test summary and security scan.
     * Missing child rows leave the matching section null.
     */
    public ApprovalDetail getApproval(Long id) {
        ApprovalRequest approval = queryMetrics.time("get_approval", () -> approvalRepository.findById(id))
                .orElseThrow(() -> ResourceNotFoundException.approvalNotFound(id));

        TestSummaryView testSummary = queryMetrics.time("latest_test_summary",
                        () -> testSummaryRepository.findFirstByApprovalIdOrderByCreatedAtDescIdDesc(id))
                .map(TestSummaryView::from)
                .orElse(null);
        SecurityScanView securityScan = queryMetrics.time("latest_security_scan",
                        () -> securityScanRepository.findFirstByApprovalIdOrderByScannedAtDescIdDesc(id))
                .map(SecurityScanView::from)
                .orElse(null);

        log.debug("Approval {} loaded (test summary: {}, security scan: {})",
                id, testSummary != null, securityScan != null);
        return ApprovalDetail.from(approval, testSummary, securityScan);
    }

    /** Every test case recorded for an approval, most recently started first. */
    public List<TestResultView> getTestResults(Long approvalId) {
        if (!approvalRepository.existsById(approvalId)) {
            throw ResourceNotFoundException.approvalNotFound(approvalId);
        }
        return queryMetrics.time("list_test_results",
                        () -> testResultRepository.findByApprovalIdOrderByStartedAtDescIdDesc(approvalId))
                .stream()
                .map(TestResultView::from)
                .toList();
    }
}
