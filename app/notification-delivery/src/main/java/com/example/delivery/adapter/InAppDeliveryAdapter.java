/*
 * どこで: Notification Delivery 配信アダプタ
 * 何を: in_app 通知を記録済みとして扱う
 * なぜ: in_app は外部トランスポートを持たず、記録をもって配信とするため
 */
package com.example.delivery.adapter;

import com.example.delivery.model.NotificationChannel;
import com.example.delivery.model.NotificationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InAppDeliveryAdapter implements DeliveryAdapter {

  private static final Logger logger = LoggerFactory.getLogger(InAppDeliveryAdapter.class);

  @Override
  public NotificationChannel channel() {
    return NotificationChannel.IN_APP;
  }

  @Override
  public DeliveryResult deliver(NotificationRecord notification) {
    logger.info(
        "in-app notification recorded id={} userId={}",
        notification.notificationId(),
        notification.userId());
    return DeliveryResult.ok();
  }
}
