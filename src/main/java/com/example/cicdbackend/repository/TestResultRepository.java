package com.example.cicdbackend.repository;

import com.example.cicdbackend.domain.TestResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TestResultRepository extends JpaRepository<TestResult, Long> {

    List<TestResult> findByApprovalIdOrderByStartedAtDescIdDesc(Long approvalId);
}
