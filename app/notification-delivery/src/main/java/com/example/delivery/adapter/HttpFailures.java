/*
 * どこで: Notification Delivery 配信アダプタ
 * 何を: RestClient の例外を配信失敗理由へ変換する
 * なぜ: email/sms アダプタでタイムアウト判定と文言を揃えるため
 */
package com.example.delivery.adapter;

import java.net.SocketTimeoutException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

final class HttpFailures {

  private HttpFailures() {}

  static DeliveryResult fromResponse(String provider, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    if (ex.getStatusCode().is5xxServerError()) {
      return DeliveryResult.failed(provider + " server error status=" + status);
    }
    return DeliveryResult.failed(provider + " rejected request status=" + status);
  }

  static DeliveryResult fromResourceAccess(String provider, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      return DeliveryResult.failed(provider + " request timeout");
    }
    return DeliveryResult.failed(provider + " unreachable: " + ex.getMessage());
  }

  private static boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
