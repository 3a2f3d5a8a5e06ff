/*
 * どこで: Notification Delivery API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.delivery.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    NOTIFICATION_NOT_FOUND,
    NOTIFICATION_STATE_CONFLICT,
    QUEUE_UNAVAILABLE
}
