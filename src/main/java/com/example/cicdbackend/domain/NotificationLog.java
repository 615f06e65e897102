package com.example.cicdbackend.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Record of a notification sent by the delivery side of the pipeline.
 */
@Entity
@Table(name = "notification_logs", indexes = {
        @Index(name = "idx_notification_sent_at", columnList = "sent_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Free-text column holding email / slack / telegram. */
    @Convert(converter = NotificationTypeConverter.class)
    @Column(name = "notification_type", nullable = false, length = 50)
    private NotificationType notificationType;

    @Column(nullable = false, length = 200)
    private String recipient;

    @Column(length = 500)
    private String subject;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "approval_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private ApprovalRequest approval;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "deployment_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Deployment deployment;

    @Column(name = "sent_successfully")
    @Builder.Default
    private Boolean sentSuccessfully = false;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "sent_at", nullable = false)
    private Instant sentAt;

    public enum NotificationType implements WireEnum {
        EMAIL("email"),
        SLACK("slack"),
        TELEGRAM("telegram");

        private final String value;

        NotificationType(String value) {
            this.value = value;
        }

        @JsonValue
        @Override
        public String getValue() {
            return value;
        }
    }

    @PrePersist
    protected void onCreate() {
        if (sentAt == null) sentAt = Instant.now();
    }
}
