package com.designgrowth.backend.mapper;

import com.designgrowth.backend.dto.request.CreateNotificationRequest;
import com.designgrowth.backend.model.Notification;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

@Component
public class NotificationMapper {

    public Notification toDocument(CreateNotificationRequest request) {
        return Notification.builder()
                .userId(request.getUserId())
                .kind(request.getKind())
                .message(request.getMessage())
                .sentVia(request.getSentVia() != null ? request.getSentVia() : new ArrayList<>())
                .build();
    }
}
