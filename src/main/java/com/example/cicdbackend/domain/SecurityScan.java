package com.example.cicdbackend.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Vulnerability scan of a build image (trivy, ...).
 */
@Entity
@Table(name = "security_scans", indexes = {
        @Index(name = "idx_security_scan_build_number", columnList = "build_number"),
        @Index(name = "idx_security_scan_job_name", columnList = "job_name")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SecurityScan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "build_number", nullable = false, length = 50)
    private String buildNumber;

    @Column(name = "job_name", nullable = false, length = 100)
    private String jobName;

    @Column(nullable = false, length = 50)
    private String scanner;

    @Column(name = "critical_count")
    @Builder.Default
    private Integer criticalCount = 0;

    @Column(name = "high_count")
    @Builder.Default
    private Integer highCount = 0;

    @Column(name = "medium_count")
    @Builder.Default
    private Integer mediumCount = 0;

    @Column(name = "low_count")
    @Builder.Default
    private Integer lowCount = 0;

    @Convert(converter = VulnerabilitiesConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<Map<String, Object>> vulnerabilities;

    @Column(name = "report_url", length = 500)
    private String reportUrl;

    @Column(name = "scanned_at", nullable = false)
    private Instant scannedAt;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "approval_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private ApprovalRequest approval;

    @PrePersist
    protected void onCreate() {
        if (scannedAt == null) scannedAt = Instant.now();
    }
}
