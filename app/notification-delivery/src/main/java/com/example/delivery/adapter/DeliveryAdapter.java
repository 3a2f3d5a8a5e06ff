/*
 * どこで: Notification Delivery 配信アダプタ
 * 何を: チャネルごとの配信能力を表すインターフェース
 * なぜ: 実送信/テスト差し替えを容易にし、エンジンから分岐を排除するため
 */
package com.example.delivery.adapter;

import com.example.delivery.model.NotificationChannel;
import com.example.delivery.model.NotificationRecord;

public interface DeliveryAdapter {

  NotificationChannel channel();

  /**
   * 役割: 1 件の通知を外部トランスポートへ送る。
   * 動作: 想定内の失敗(到達不能/宛先不正/拒否/タイムアウト)は {@link DeliveryResult#failed} で返す。
   * 前提: 例外は設定不備など想定外の場合に限る。
   */
  DeliveryResult deliver(NotificationRecord notification);

  default boolean isConfigured() {
    return true;
  }
}
