/*
 * どこで: Notification Delivery サービス層
 * 何を: NATS 無効時にキュー投入をログへ残すだけの publisher
 * なぜ: ローカル/テスト環境でブローカーなしに API を動かすため
 */
package com.example.delivery.service;

import com.example.delivery.model.NotificationQueueMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LoggingNotificationQueuePublisher implements NotificationQueuePublisher {

    private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationQueuePublisher.class);

    @Override
    public void publish(NotificationQueueMessage message, String dedupKey) {
        // NATS 無効時はログ出力のみで実送信しない
        logger.info("notification publish skipped (nats disabled) id={} msgId={}",
                message.notificationId(), dedupKey);
    }

    @Override
    public void publishDeadLetter(NotificationQueueMessage message, String dedupKey) {
        logger.info("notification dead-letter publish skipped (nats disabled) id={} msgId={}",
                message.notificationId(), dedupKey);
    }
}
