/*
 * どこで: Notification Delivery 配信アダプタ
 * 何を: 配信結果(成功/失敗理由)を表す
 * なぜ: 想定内の失敗を例外ではなく値として状態機械へ渡すため
 */
package com.example.delivery.adapter;

public record DeliveryResult(boolean success, String error) {

  private static final DeliveryResult OK = new DeliveryResult(true, null);

  public static DeliveryResult ok() {
    return OK;
  }

  public static DeliveryResult failed(String error) {
    return new DeliveryResult(false, error == null || error.isBlank() ? "unknown error" : error);
  }
}
