/*
 * どこで: Notification Delivery ドメインモデル
 * 何を: notifications テーブルのスナップショット
 * なぜ: 配信エンジン/リトライスケジューラ/API で共通化するため
 */
package com.example.delivery.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    String userId,
    NotificationChannel channel,
    String message,
    String destination,
    NotificationStatus status,
    int retryCount,
    Instant nextRetryTime,
    String lastError,
    int retryGeneration,
    Instant requeuedAt,
    String lockedBy,
    Instant leaseUntil,
    Instant createdAt,
    Instant updatedAt,
    Instant sentAt,
    Instant deadLetteredAt) {

  public static NotificationRecord newPending(
      UUID notificationId,
      String userId,
      NotificationChannel channel,
      String message,
      String destination,
      Instant now) {
    return new NotificationRecord(
        notificationId,
        userId,
        channel,
        message,
        destination,
        NotificationStatus.PENDING,
        0,
        null,
        null,
        0,
        null,
        null,
        null,
        now,
        now,
        null,
        null);
  }
}
