package com.example.cicdbackend.controller;

import com.example.cicdbackend.dto.NotificationView;
import com.example.cicdbackend.service.NotificationQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationQueryService notificationService;

    @GetMapping
    public ResponseEntity<Map<String, Object>> listNotifications(
            @RequestParam(required = false) String type,
            @RequestParam(defaultValue = "20") int limit) {
        List<NotificationView> notifications = notificationService.listNotifications(type, limit);
        return ResponseEntity.ok(Map.of(
                "count", notifications.size(),
                "notifications", notifications
        ));
    }
}
