/*
 * どこで: Notification Delivery API
 * 何を: 通知の作成/参照/一覧/手動リトライ/集計のエンドポイントを提供する
 * なぜ: 配信パイプラインへの入口と運用向けの参照口を用意するため
 */
package com.example.delivery.api;

import com.example.delivery.model.NotificationChannel;
import com.example.delivery.model.NotificationRecord;
import com.example.delivery.service.NotificationCommandService;
import com.example.delivery.service.NotificationCreateCommand;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class NotificationController {

    private final NotificationCommandService commandService;

    @PostMapping("/notifications")
    public ResponseEntity<NotificationAcceptedResponse> create(
            @Valid @RequestBody CreateNotificationRequest request) {
        NotificationRecord record = commandService.create(new NotificationCreateCommand(
                request.userId(),
                NotificationChannel.fromValue(request.channel()),
                request.message(),
                request.destination()));
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new NotificationAcceptedResponse(record.notificationId(), record.status().value()));
    }

    @GetMapping("/notifications/stats")
    public NotificationStatsResponse stats() {
        return new NotificationStatsResponse(commandService.stats());
    }

    @GetMapping("/notifications/{notification_id}")
    public NotificationResponse get(@PathVariable("notification_id") UUID notificationId) {
        return NotificationResponse.from(commandService.get(notificationId));
    }

    @PostMapping("/notifications/{notification_id}/retry")
    public ResponseEntity<NotificationAcceptedResponse> retry(
            @PathVariable("notification_id") UUID notificationId) {
        NotificationRecord record = commandService.retry(notificationId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new NotificationAcceptedResponse(record.notificationId(), record.status().value()));
    }

    @GetMapping("/users/{user_id}/notifications")
    public NotificationsResponse listByUser(
            @PathVariable("user_id")
            @NotBlank(message = "user_id is required")
            String userId,
            @RequestParam(value = "channel", required = false) String channel) {
        NotificationChannel channelFilter =
                channel == null || channel.isBlank() ? null : NotificationChannel.fromValue(channel);
        List<NotificationResponse> notifications = commandService.listByUser(userId, channelFilter).stream()
                .map(NotificationResponse::from)
                .toList();
        return new NotificationsResponse(userId, notifications);
    }
}
