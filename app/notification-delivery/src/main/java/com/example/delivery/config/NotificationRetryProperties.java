/*
 * どこで: Notification Delivery の設定バインド
 * 何を: リトライスケジューラのスキャン間隔/バッチ/再 claim 設定を保持する
 * なぜ: 再投入の頻度と取りこぼし回復の猶予を環境で調整するため
 */
package com.example.delivery.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.retry")
@Validated
public record NotificationRetryProperties(
    boolean enabled,
    @NotNull Duration scanInterval,
    @Positive int batchSize,
    @Positive int maxBatchesPerScan,
    @NotNull Duration reclaimAfter,
    @NotNull Duration stalePendingAfter,
    boolean manualRetryFromScheduled) {

  @AssertTrue(message = "notification.retry durations must be positive")
  public boolean isDurationsPositive() {
    return isPositive(scanInterval) && isPositive(reclaimAfter) && isPositive(stalePendingAfter);
  }

  private boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
