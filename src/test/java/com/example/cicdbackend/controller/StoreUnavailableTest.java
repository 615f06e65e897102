package com.example.cicdbackend.controller;

import com.example.cicdbackend.repository.ApprovalRequestRepository;
import com.example.cicdbackend.repository.DeploymentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.CannotCreateTransactionException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * The store refuses every query; reads fail with 503 while liveness stays up.
 */
@SpringBootTest
@AutoConfigureMockMvc
class StoreUnavailableTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ApprovalRequestRepository approvalRepository;

    @MockBean
    private DeploymentRepository deploymentRepository;

    @BeforeEach
    void storeIsDown() {
        given(approvalRepository.findAllByOrderByRequestedAtDescIdDesc(any(Pageable.class)))
                .willThrow(new DataAccessResourceFailureException("Connection refused"));
        given(approvalRepository.findById(anyLong()))
                .willThrow(new DataAccessResourceFailureException("Connection refused"));
        given(deploymentRepository.findAllByOrderByStartedAtDescIdDesc(any(Pageable.class)))
                .willThrow(new CannotCreateTransactionException("Could not open JPA EntityManager"));
    }

    @Test
    void approvalQueriesReportStoreUnavailable() throws Exception {
        mockMvc.perform(get("/api/v1/approvals"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"))
                .andExpect(jsonPath("$.error").value("Database is unavailable"));

        mockMvc.perform(get("/api/v1/approvals/1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"));
    }

    @Test
    void transactionFailureReportsStoreUnavailable() throws Exception {
        mockMvc.perform(get("/api/v1/deployments"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"));
    }

    @Test
    void healthStaysUpWhileStoreIsDown() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.service").value("backend"));
    }
}
