package com.example.cicdbackend;

import com.example.cicdbackend.domain.ApprovalRequest;
import com.example.cicdbackend.domain.Deployment;
import com.example.cicdbackend.domain.NotificationLog;
import com.example.cicdbackend.domain.SecurityScan;
import com.example.cicdbackend.domain.TestResult;
import com.example.cicdbackend.domain.TestSummary;

import java.time.Instant;

/**
 * Entity builders pre-filled with the mandatory columns.
 */
public final class Fixtures {

    public static final Instant BASE_TIME = Instant.parse("2026-03-01T10:00:00Z");

    private Fixtures() {
    }

    public static ApprovalRequest.ApprovalRequestBuilder approval(String buildNumber, int minutesAfterBase) {
        return ApprovalRequest.builder()
                .buildNumber(buildNumber)
                .jobName("backend-pipeline")
                .requestedBy("jenkins")
                .gitCommit("a1b2c3d4e5f6a7b8c9d0a1b2c3d4e5f6a7b8c9d0")
                .gitBranch("main")
                .requestedAt(BASE_TIME.plusSeconds(60L * minutesAfterBase));
    }

    public static Deployment.DeploymentBuilder deployment(String buildNumber,
                                                          Deployment.Environment environment,
                                                          int minutesAfterBase) {
        return Deployment.builder()
                .buildNumber(buildNumber)
                .jobName("backend-pipeline")
                .environment(environment)
                .gitCommit("a1b2c3d4e5f6a7b8c9d0a1b2c3d4e5f6a7b8c9d0")
                .gitBranch("main")
                .deployedBy("jenkins")
                .startedAt(BASE_TIME.plusSeconds(60L * minutesAfterBase));
    }

    public static TestSummary.TestSummaryBuilder testSummary(ApprovalRequest approval, int minutesAfterBase) {
        return TestSummary.builder()
                .buildNumber(approval.getBuildNumber())
                .jobName(approval.getJobName())
                .approval(approval)
                .createdAt(BASE_TIME.plusSeconds(60L * minutesAfterBase));
    }

    public static SecurityScan.SecurityScanBuilder securityScan(ApprovalRequest approval, int minutesAfterBase) {
        return SecurityScan.builder()
                .buildNumber(approval.getBuildNumber())
                .jobName(approval.getJobName())
                .scanner("trivy")
                .approval(approval)
                .scannedAt(BASE_TIME.plusSeconds(60L * minutesAfterBase));
    }

    public static TestResult.TestResultBuilder testResult(ApprovalRequest approval, String testName,
                                                          int minutesAfterBase) {
        return TestResult.builder()
                .buildNumber(approval.getBuildNumber())
                .jobName(approval.getJobName())
                .testSuite("pytest")
                .testName(testName)
                .approval(approval)
                .startedAt(BASE_TIME.plusSeconds(60L * minutesAfterBase));
    }

    public static NotificationLog.NotificationLogBuilder notification(NotificationLog.NotificationType type,
                                                                      int minutesAfterBase) {
        return NotificationLog.builder()
                .notificationType(type)
                .recipient("ops@example.com")
                .subject("Approval required")
                .message("Build is waiting for approval")
                .sentAt(BASE_TIME.plusSeconds(60L * minutesAfterBase));
    }
}
