/*
 * どこで: Notification Delivery サービス層
 * 何を: キュー(JetStream)への publish 失敗を表す例外
 * なぜ: ブローカー障害を配信失敗と区別して扱うため
 */
package com.example.delivery.service;

public class NotificationQueueException extends RuntimeException {

  public NotificationQueueException(String message, Throwable cause) {
    super(message, cause);
  }
}
