package com.example.cicdbackend.repository;

import com.example.cicdbackend.domain.NotificationLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface NotificationLogRepository extends JpaRepository<NotificationLog, Long> {

    List<NotificationLog> findAllByOrderBySentAtDescIdDesc(Pageable pageable);

    List<NotificationLog> findByNotificationTypeOrderBySentAtDescIdDesc(NotificationLog.NotificationType type,
                                                                       Pageable pageable);
}
