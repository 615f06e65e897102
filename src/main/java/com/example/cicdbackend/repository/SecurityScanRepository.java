package com.example.cicdbackend.repository;

import com.example.cicdbackend.domain.SecurityScan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SecurityScanRepository extends JpaRepository<SecurityScan, Long> {

    Optional<SecurityScan> findFirstByApprovalIdOrderByScannedAtDescIdDesc(Long approvalId);
}
