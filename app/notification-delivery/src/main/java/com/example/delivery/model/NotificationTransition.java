/*
 * どこで: Notification Delivery ドメインモデル
 * 何を: 状態遷移の結果(遷移先/回数/次回時刻/エラー/DLQ要否)
 * なぜ: 遷移判断と永続化を分離し、純粋関数として検証できるようにするため
 */
package com.example.delivery.model;

import java.time.Instant;

public record NotificationTransition(
    NotificationStatus target,
    int retryCount,
    Instant nextRetryTime,
    String lastError,
    boolean deadLetter) {}
