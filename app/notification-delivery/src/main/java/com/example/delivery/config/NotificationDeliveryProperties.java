/*
 * どこで: Notification Delivery の設定バインド
 * 何を: 配信エンジンの lease/エラー記録設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.example.delivery.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.delivery")
@Validated
public record NotificationDeliveryProperties(
    @NotNull Duration lease, @Positive int errorMessageMaxLength) {

  @AssertTrue(message = "notification.delivery.lease must be positive")
  public boolean isLeasePositive() {
    return lease != null && !lease.isZero() && !lease.isNegative();
  }
}
