/*
 * どこで: Notification Delivery ドメインモデル
 * 何を: 通知チャネル(email/sms/in_app)を表す閉じた列挙
 * なぜ: チャネルごとの配信アダプタ解決と宛先要否を一箇所で決めるため
 */
package com.example.delivery.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationChannel {
  EMAIL("email", true),
  SMS("sms", true),
  IN_APP("in_app", false);

  private final String value;
  private final boolean destinationRequired;

  NotificationChannel(String value, boolean destinationRequired) {
    this.value = value;
    this.destinationRequired = destinationRequired;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean destinationRequired() {
    return destinationRequired;
  }

  @JsonCreator
  public static NotificationChannel fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("channel is required");
    }
    for (NotificationChannel channel : values()) {
      if (channel.value.equalsIgnoreCase(value) || channel.name().equalsIgnoreCase(value)) {
        return channel;
      }
    }
    throw new IllegalArgumentException("unsupported channel: " + value);
  }
}
