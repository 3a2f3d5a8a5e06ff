/*
 * どこで: Notification Delivery サービス層
 * 何を: 配信結果/DLQ/再投入/backlog/E2E 遅延のメトリクスを記録する
 * なぜ: リトライと dead-letter の挙動を Prometheus から観測するため
 */
package com.example.delivery.service;

import com.example.delivery.model.NotificationChannel;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationMetrics {

  private static final String METRIC_DELIVERY_TOTAL = "notification.delivery.total";
  private static final String METRIC_DELIVERY_E2E_DELAY = "notification.delivery.e2e.delay";
  private static final String METRIC_BACKLOG_CURRENT = "notification.backlog.current";
  private static final String METRIC_DLQ_TOTAL = "notification.dlq.total";
  private static final String METRIC_RETRY_REQUEUED_TOTAL = "notification.retry.requeued.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final Counter dlqCounter;
  private final Counter requeuedCounter;
  private final Timer deliveryE2eDelayTimer;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Current number of pending or retry-scheduled notifications")
        .register(meterRegistry);
    this.dlqCounter =
        Counter.builder(METRIC_DLQ_TOTAL)
            .description("Total number of notifications moved to the dead-letter stream")
            .register(meterRegistry);
    this.requeuedCounter =
        Counter.builder(METRIC_RETRY_REQUEUED_TOTAL)
            .description("Total number of notifications re-published by the retry scheduler")
            .register(meterRegistry);
    this.deliveryE2eDelayTimer =
        Timer.builder(METRIC_DELIVERY_E2E_DELAY)
            .description("End-to-end delivery delay from created_at to sent_at")
            .register(meterRegistry);
  }

  public void recordDeliveryResult(NotificationChannel channel, String result) {
    deliveryCounters
        .computeIfAbsent(
            channel.value() + ":" + result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Notification delivery outcomes")
                    .tags(Tags.of("channel", channel.value(), "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDeliveryE2eDelay(Instant createdAt, Instant sentAt) {
    if (createdAt == null || sentAt == null || sentAt.isBefore(createdAt)) {
      return;
    }
    deliveryE2eDelayTimer.record(Duration.between(createdAt, sentAt));
  }

  public void recordDlqMoved() {
    dlqCounter.increment();
  }

  public void recordRequeued(int count) {
    if (count > 0) {
      requeuedCounter.increment(count);
    }
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }
}
