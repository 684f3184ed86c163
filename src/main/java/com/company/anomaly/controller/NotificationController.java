package com.company.anomaly.controller;

import com.company.anomaly.dto.response.NotificationResponse;
import com.company.anomaly.repository.InAppNotificationRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/notifications")
@Tag(name = "Notifications", description = "In-app anomaly alerts")
@RequiredArgsConstructor
public class NotificationController {

    private static final int MAX_LIMIT = 200;

    private final InAppNotificationRepository notificationRepository;

    @GetMapping
    @Operation(summary = "Most recent in-app notifications")
    public ResponseEntity<List<NotificationResponse>> recentNotifications(
            @RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return ResponseEntity.ok(notificationRepository.findRecent(limit).stream()
                .map(NotificationResponse::from)
                .toList());
    }
}
