/*
 * どこで: Notification Delivery 配信アダプタ
 * 何を: CI/Test 専用で配信失敗を注入するデコレータ
 * なぜ: 実コード経路を汚さずに E2E で retry -> DLQ を再現するため
 */
package com.example.delivery.adapter;

import com.example.delivery.model.NotificationChannel;
import com.example.delivery.model.NotificationRecord;

public class FailureInjectingDeliveryAdapter implements DeliveryAdapter {

  private final DeliveryAdapter delegate;
  private final String userIdPrefix;

  public FailureInjectingDeliveryAdapter(DeliveryAdapter delegate, String userIdPrefix) {
    this.delegate = delegate;
    this.userIdPrefix = userIdPrefix;
  }

  @Override
  public NotificationChannel channel() {
    return delegate.channel();
  }

  @Override
  public boolean isConfigured() {
    return delegate.isConfigured();
  }

  @Override
  public DeliveryResult deliver(NotificationRecord notification) {
    if (shouldInjectFailure(notification.userId())) {
      return DeliveryResult.failed(
          "notification delivery failure injection matched userId=" + notification.userId());
    }
    return delegate.deliver(notification);
  }

  private boolean shouldInjectFailure(String userId) {
    if (userIdPrefix == null || userIdPrefix.isBlank() || userId == null) {
      return false;
    }
    return userId.startsWith(userIdPrefix);
  }
}
