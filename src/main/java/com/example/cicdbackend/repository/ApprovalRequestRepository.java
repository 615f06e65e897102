package com.example.cicdbackend.repository;

import com.example.cicdbackend.domain.ApprovalRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ApprovalRequestRepository extends JpaRepository<ApprovalRequest, Long> {

    /** Newest first; id breaks ties between equal request times */
    List<ApprovalRequest> findAllByOrderByRequestedAtDescIdDesc(Pageable pageable);

    List<ApprovalRequest> findByStatusOrderByRequestedAtDescIdDesc(ApprovalRequest.ApprovalStatus status,
                                                                  Pageable pageable);
}
