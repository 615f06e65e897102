package com.example.cicdbackend.domain;

import jakarta.persistence.Converter;

@Converter
public class NotificationTypeConverter extends WireValueConverter<NotificationLog.NotificationType> {

    public NotificationTypeConverter() {
        super(NotificationLog.NotificationType.class);
    }
}
