/*
 * どこで: Notification Delivery サービス層
 * 何を: primary/dead-letter stream への投入口
 * なぜ: エンジン/スケジューラをブローカー実装から切り離すため
 */
package com.example.delivery.service;

import com.example.delivery.model.NotificationQueueMessage;

public interface NotificationQueuePublisher {

  /**
   * primary stream に投入する。
   *
   * @param dedupKey Nats-Msg-Id として使う重複排除キー
   * @throws NotificationQueueException publish ack を得られなかった場合
   */
  void publish(NotificationQueueMessage message, String dedupKey);

  /** dead-letter stream に投入する。失敗時は {@link NotificationQueueException}。 */
  void publishDeadLetter(NotificationQueueMessage message, String dedupKey);
}
