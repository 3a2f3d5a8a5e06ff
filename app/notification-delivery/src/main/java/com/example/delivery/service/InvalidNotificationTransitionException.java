/*
 * どこで: Notification Delivery サービス層
 * 何を: 許可されない状態遷移(409)を表す例外
 * なぜ: 終端状態からの不正な遷移を呼び出し元へ明示するため
 */
package com.example.delivery.service;

public class InvalidNotificationTransitionException extends RuntimeException {

    public InvalidNotificationTransitionException(String message) {
        super(message);
    }
}
