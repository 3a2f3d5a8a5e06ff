/*
 * どこで: Notification Delivery サービス層
 * 何を: 再配信しても回復しないキューメッセージを表す例外
 * なぜ: Subscriber が TERM で再配信を打ち切る判断を明確にするため
 */
package com.example.delivery.service;

public class NotificationMessagePermanentException extends RuntimeException {

  public NotificationMessagePermanentException(String message) {
    super(message);
  }

  public NotificationMessagePermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
