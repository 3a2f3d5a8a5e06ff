/*
 * どこで: Notification Delivery API
 * 何を: 通知 1 件の参照レスポンス
 * なぜ: lease など内部の列を外に出さずに状態を返すため
 */
package com.example.delivery.api;

import com.example.delivery.model.NotificationRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationResponse(
    UUID notificationId,
    String userId,
    String channel,
    String message,
    String destination,
    String status,
    int retryCount,
    Instant nextRetryTime,
    String lastError,
    Instant createdAt,
    Instant updatedAt,
    Instant sentAt) {

  public static NotificationResponse from(NotificationRecord record) {
    return new NotificationResponse(
        record.notificationId(),
        record.userId(),
        record.channel().value(),
        record.message(),
        record.destination(),
        record.status().value(),
        record.retryCount(),
        record.nextRetryTime(),
        record.lastError(),
        record.createdAt(),
        record.updatedAt(),
        record.sentAt());
  }
}
