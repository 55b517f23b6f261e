package com.designgrowth.backend.service;

import com.designgrowth.backend.dto.request.CreateNotificationRequest;
import com.designgrowth.backend.mapper.NotificationMapper;
import com.designgrowth.backend.model.Notification;
import com.designgrowth.backend.repository.DocumentFilter;
import com.designgrowth.backend.repository.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class NotificationService {

    public static final int LIST_LIMIT = 200;

    @Autowired
    private DocumentStore documentStore;

    @Autowired
    private NotificationMapper notificationMapper;

    public String createNotification(CreateNotificationRequest request) {
        String id = documentStore.create(notificationMapper.toDocument(request));
        log.info("Created notification log entry {}", id);
        return id;
    }

    public List<Notification> listNotifications(String userId) {
        DocumentFilter filter = DocumentFilter.matchAll().equalTo("userId", userId);
        return documentStore.list(Notification.class, filter, LIST_LIMIT);
    }
}
