package com.example.cicdbackend.repository;

import com.example.cicdbackend.domain.TestSummary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TestSummaryRepository extends JpaRepository<TestSummary, Long> {

    Optional<TestSummary> findFirstByApprovalIdOrderByCreatedAtDescIdDesc(Long approvalId);
}
