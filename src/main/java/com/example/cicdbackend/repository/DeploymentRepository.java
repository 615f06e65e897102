package com.example.cicdbackend.repository;

import com.example.cicdbackend.domain.Deployment;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DeploymentRepository extends JpaRepository<Deployment, Long> {

    List<Deployment> findAllByOrderByStartedAtDescIdDesc(Pageable pageable);

    List<Deployment> findByEnvironmentOrderByStartedAtDescIdDesc(Deployment.Environment environment,
                                                                 Pageable pageable);
}
