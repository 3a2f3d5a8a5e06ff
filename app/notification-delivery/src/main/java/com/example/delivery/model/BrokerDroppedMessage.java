/*
 * どこで: Notification Delivery ブローカー破棄記録
 * 何を: MaxDeliver/TERMINATED で JetStream が手放した配信メッセージ 1 件分
 * なぜ: stream_seq だけでなくどの通知のどの試行だったかを後から引けるようにするため
 */
package com.example.delivery.model;

import java.time.Instant;
import java.util.UUID;

/**
 * 本文が stream から既に消えている場合 notificationId と retryCount は null。
 */
public record BrokerDroppedMessage(
    long streamSeq,
    String kind,
    UUID notificationId,
    Integer retryCount,
    String reason,
    Instant createdAt) {}
