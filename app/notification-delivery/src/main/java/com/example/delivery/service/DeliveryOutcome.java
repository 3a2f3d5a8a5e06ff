/*
 * どこで: Notification Delivery サービス層
 * 何を: 1 メッセージ処理の結果分類
 * なぜ: Subscriber の ack/nak 判断とテストでの検証を単純にするため
 */
package com.example.delivery.service;

public enum DeliveryOutcome {
  SENT,
  RETRY_SCHEDULED,
  DEAD_LETTERED,
  /** 終端状態のため何もしない。 */
  SKIPPED_TERMINAL,
  /** retry_count 不一致や未 claim の古いメッセージ。 */
  SKIPPED_STALE,
  /** 他ワーカーが lease を保持中。 */
  IN_FLIGHT_ELSEWHERE,
  /** 配信後の CAS に負けた。 */
  LEASE_LOST
}
