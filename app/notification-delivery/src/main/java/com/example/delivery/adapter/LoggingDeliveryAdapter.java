/*
 * どこで: Notification Delivery 配信アダプタ
 * 何を: 外部送信を行わずログに残すだけの模擬アダプタ
 * なぜ: プロバイダ無効の環境でも状態遷移を確認するため
 */
package com.example.delivery.adapter;

import com.example.delivery.model.NotificationChannel;
import com.example.delivery.model.NotificationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingDeliveryAdapter implements DeliveryAdapter {

    private static final Logger logger = LoggerFactory.getLogger(LoggingDeliveryAdapter.class);

    private final NotificationChannel channel;

    public LoggingDeliveryAdapter(NotificationChannel channel) {
        this.channel = channel;
    }

    @Override
    public NotificationChannel channel() {
        return channel;
    }

    @Override
    public DeliveryResult deliver(NotificationRecord notification) {
        // 実送信は行わず、ログに残すだけとする
        logger.info("notification simulated send id={} channel={}",
                notification.notificationId(),
                channel.value());
        return DeliveryResult.ok();
    }
}
