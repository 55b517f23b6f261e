package com.designgrowth.backend.controller;

import com.designgrowth.backend.dto.CreatedResponse;
import com.designgrowth.backend.dto.request.CreateNotificationRequest;
import com.designgrowth.backend.model.Notification;
import com.designgrowth.backend.service.NotificationService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    @Autowired
    private NotificationService notificationService;

    @PostMapping
    public ResponseEntity<CreatedResponse> create(@Valid @RequestBody CreateNotificationRequest request) {
        return ResponseEntity.ok(new CreatedResponse(notificationService.createNotification(request)));
    }

    @GetMapping
    public ResponseEntity<List<Notification>> list(@RequestParam(name = "user_id", required = false) String userId) {
        return ResponseEntity.ok(notificationService.listNotifications(userId));
    }
}
