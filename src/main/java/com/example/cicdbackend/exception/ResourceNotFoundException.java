package com.example.cicdbackend.exception;

import org.springframework.http.HttpStatus;

/**
 * Requested record does not exist (HTTP 404).
 */
public class ResourceNotFoundException extends ApiException {

    public ResourceNotFoundException(String code, String message) {
        super(code, message, HttpStatus.NOT_FOUND);
    }

    public static ResourceNotFoundException approvalNotFound(Long approvalId) {
        return new ResourceNotFoundException("APPROVAL_NOT_FOUND",
                String.format("Approval request %d not found", approvalId));
    }

    public static ResourceNotFoundException deploymentNotFound(Long deploymentId) {
        return new ResourceNotFoundException("DEPLOYMENT_NOT_FOUND",
                String.format("Deployment %d not found", deploymentId));
    }
}
