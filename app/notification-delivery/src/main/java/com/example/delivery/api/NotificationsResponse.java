/*
 * どこで: Notification Delivery API
 * 何を: ユーザ通知一覧のレスポンスを表す
 * なぜ: user_id と notifications を明示的に返すため
 */
package com.example.delivery.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationsResponse(String userId, List<NotificationResponse> notifications) {
  public NotificationsResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 不変リストとして保持する
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
