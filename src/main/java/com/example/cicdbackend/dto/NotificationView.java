package com.example.cicdbackend.dto;

import com.example.cicdbackend.domain.NotificationLog;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NotificationView {

    private Long id;
    private NotificationLog.NotificationType notificationType;
    private String recipient;
    private String subject;
    private boolean sentSuccessfully;
    private String errorMessage;
    private Long approvalId;
    private Long deploymentId;
    private Instant sentAt;

    public static NotificationView from(NotificationLog notification) {
        return NotificationView.builder()
                .id(notification.getId())
                .notificationType(notification.getNotificationType())
                .recipient(notification.getRecipient())
                .subject(notification.getSubject())
                .sentSuccessfully(Boolean.TRUE.equals(notification.getSentSuccessfully()))
                .errorMessage(notification.getErrorMessage())
                .approvalId(notification.getApproval() != null ? notification.getApproval().getId() : null)
                .deploymentId(notification.getDeployment() != null ? notification.getDeployment().getId() : null)
                .sentAt(notification.getSentAt())
                .build();
    }
}
