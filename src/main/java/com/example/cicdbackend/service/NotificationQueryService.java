package com.example.cicdbackend.service;

import com.example.cicdbackend.domain.NotificationLog;
import com.example.cicdbackend.dto.NotificationView;
import com.example.cicdbackend.monitoring.QueryMetrics;
import com.example.cicdbackend.repository.NotificationLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class NotificationQueryService {

    private final NotificationLogRepository notificationRepository;
    private final QueryLimits queryLimits;
    private final QueryMetrics queryMetrics;

    public List<NotificationView> listNotifications(String type, int limit) {
        NotificationLog.NotificationType filter =
                queryLimits.parseFilter(NotificationLog.NotificationType.class, "type", type);
        int size = queryLimits.cap(limit);
        if (size == 0) return List.of();

        List<NotificationLog> notifications = queryMetrics.time("list_notifications", () -> filter == null
                ? notificationRepository.findAllByOrderBySentAtDescIdDesc(PageRequest.of(0, size))
                : notificationRepository.findByNotificationTypeOrderBySentAtDescIdDesc(filter, PageRequest.of(0, size)));

        return notifications.stream().map(NotificationView::from).toList();
    }
}
