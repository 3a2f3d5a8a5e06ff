/*
 * どこで: Notification Delivery サービス層
 * 何を: 失敗回数から次回リトライまでの待ち時間を表で決める
 * なぜ: 再送間隔を決定的にし、運用者が予測できるようにするため
 */
package com.example.delivery.service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public final class NotificationBackoffPolicy {

  public static final int MAX_RETRIES = 5;

  // index = 失敗回数 - 1。jitter は入れない
  private static final List<Duration> WAITS =
      List.of(
          Duration.ofSeconds(30),
          Duration.ofMinutes(2),
          Duration.ofMinutes(10),
          Duration.ofMinutes(30),
          Duration.ofHours(1));

  private NotificationBackoffPolicy() {}

  public static Duration waitDuration(int attempt) {
    if (attempt < 1 || attempt > MAX_RETRIES) {
      throw new IllegalArgumentException(
          "attempt must be between 1 and " + MAX_RETRIES + ": " + attempt);
    }
    return WAITS.get(attempt - 1);
  }

  public static boolean isExhausted(int retryCount) {
    return retryCount >= MAX_RETRIES;
  }

  public static Optional<Instant> nextRetryTime(int retryCount, Instant now) {
    if (isExhausted(retryCount)) {
      return Optional.empty();
    }
    return Optional.of(now.plus(waitDuration(retryCount)));
  }
}
