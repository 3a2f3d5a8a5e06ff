/*
 * どこで: Notification Delivery キューメッセージ
 * 何を: primary/dead-letter stream に載せる JSON ペイロード
 * なぜ: ワーカーがストア往復なしでも処理内容を把握できるようにするため
 */
package com.example.delivery.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationQueueMessage(
    UUID notificationId,
    String userId,
    NotificationChannel channel,
    String message,
    String destination,
    int retryCount) {

  public static NotificationQueueMessage from(NotificationRecord record) {
    return new NotificationQueueMessage(
        record.notificationId(),
        record.userId(),
        record.channel(),
        record.message(),
        record.destination(),
        record.retryCount());
  }

  public NotificationQueueMessage withRetryCount(int newRetryCount) {
    return new NotificationQueueMessage(
        notificationId, userId, channel, message, destination, newRetryCount);
  }

  // Nats-Msg-Id に載せる重複排除キー。世代と試行回数ごとに一意になる
  public static String primaryDedupKey(NotificationRecord record) {
    return record.notificationId() + "." + record.retryGeneration() + "." + record.retryCount();
  }

  public static String deadLetterDedupKey(NotificationRecord record) {
    return "dlq." + record.notificationId() + "." + record.retryGeneration();
  }
}
