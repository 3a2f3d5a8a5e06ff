/*
 * どこで: Notification Delivery ドメインモデル
 * 何を: 通知の永続化される状態を表す列挙
 * なぜ: DB と状態遷移ロジックの状態を一致させるため
 */
package com.example.delivery.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum NotificationStatus {
  PENDING,
  SENT,
  RETRY_SCHEDULED,
  FAILED_PERMANENTLY;

  public boolean isTerminal() {
    return this == SENT || this == FAILED_PERMANENTLY;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
