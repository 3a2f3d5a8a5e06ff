/*
 * どこで: Notification Delivery サービス層
 * 何を: 期限到来した RETRY_SCHEDULED と放置された PENDING を再投入し、未投入の dead-letter を送り出す
 * なぜ: 待機中の通知を backoff 表どおりの時刻に primary stream へ戻すため
 */
package com.example.delivery.service;

import com.example.delivery.config.NotificationRetryProperties;
import com.example.delivery.model.NotificationQueueMessage;
import com.example.delivery.model.NotificationRecord;
import com.example.delivery.repository.NotificationRepository;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * 単一スレッドの固定遅延ループで {@link #scanOnce()} を実行する。
 *
 * <p>claim は {@code requeued_at} による行単位のマーカーで、複数インスタンスが同時にスキャンしても
 * 同じ通知を同一サイクルで二重投入しない。投入に失敗した claim は解放し、そのサイクルは打ち切る。
 */
@Component
@ConditionalOnProperty(name = "notification.retry.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationRetryScheduler implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetryScheduler.class);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5L;

  private final NotificationRepository notificationRepository;
  private final NotificationQueuePublisher queuePublisher;
  private final NotificationMetrics metrics;
  private final NotificationRetryProperties properties;
  private final Clock clock;

  private ScheduledExecutorService executor;
  private ScheduledFuture<?> scanTask;
  private volatile boolean running;

  public NotificationRetryScheduler(
      NotificationRepository notificationRepository,
      NotificationQueuePublisher queuePublisher,
      NotificationMetrics metrics,
      NotificationRetryProperties properties,
      Clock clock) {
    this.notificationRepository = notificationRepository;
    this.queuePublisher = queuePublisher;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    executor =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("notification-retry-scheduler-%d")
                .setDaemon(true)
                .build());
    final long intervalMillis = properties.scanInterval().toMillis();
    scanTask =
        executor.scheduleWithFixedDelay(
            this::runScan, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    running = true;
    logger.info(
        "notification retry scheduler started scanInterval={} batchSize={}",
        properties.scanInterval(),
        properties.batchSize());
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    if (scanTask != null) {
      scanTask.cancel(false);
      scanTask = null;
    }
    if (executor != null) {
      executor.shutdown();
      try {
        if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
          executor.shutdownNow();
        }
      } catch (InterruptedException ex) {
        executor.shutdownNow();
        Thread.currentThread().interrupt();
      }
      executor = null;
    }
    logger.info("notification retry scheduler stopped");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  private void runScan() {
    try {
      scanOnce();
    } catch (RuntimeException ex) {
      // 例外で固定遅延ループが止まらないよう、ここで記録して次サイクルへ進む
      logger.warn("notification retry scan failed", ex);
    }
  }

  /** 1 サイクル分のスキャン。テストや手動実行からも直接呼べる。 */
  public ScanResult scanOnce() {
    final Instant now = Instant.now(clock);
    final Set<UUID> published = new HashSet<>();
    final Instant reclaimBefore = now.minus(properties.reclaimAfter());
    final BatchResult due =
        drain(
            limit -> notificationRepository.claimDueRetries(limit, now, reclaimBefore),
            this::publishPrimary,
            published);
    BatchResult stale = BatchResult.SKIPPED;
    BatchResult deadLetters = BatchResult.SKIPPED;
    if (!due.aborted()) {
      final Instant staleBefore = now.minus(properties.stalePendingAfter());
      stale =
          drain(
              limit -> notificationRepository.claimStalePending(limit, now, staleBefore),
              this::publishPrimary,
              published);
    }
    if (!due.aborted() && !stale.aborted()) {
      // 配信ワーカー自身の投入を 1 スキャン間隔だけ待ってから拾う
      final Instant deadLetteredBefore = now.minus(properties.scanInterval());
      deadLetters =
          drain(
              limit ->
                  notificationRepository.claimUnpublishedDeadLetters(limit, now, deadLetteredBefore),
              record -> publishDeadLetter(record, now),
              published);
    }
    final boolean aborted = due.aborted() || stale.aborted() || deadLetters.aborted();
    metrics.recordRequeued(due.published() + stale.published());
    metrics.updateBacklogCurrent(notificationRepository.countBacklog());
    if (due.published() > 0 || stale.published() > 0 || deadLetters.published() > 0 || aborted) {
      logger.info(
          "notification retry scan finished requeued={} stalePending={} deadLetters={} aborted={}",
          due.published(),
          stale.published(),
          deadLetters.published(),
          aborted);
    }
    return new ScanResult(due.published(), stale.published(), deadLetters.published(), aborted);
  }

  private void publishPrimary(NotificationRecord record) {
    queuePublisher.publish(
        NotificationQueueMessage.from(record), NotificationQueueMessage.primaryDedupKey(record));
  }

  private void publishDeadLetter(NotificationRecord record, Instant now) {
    queuePublisher.publishDeadLetter(
        NotificationQueueMessage.from(record), NotificationQueueMessage.deadLetterDedupKey(record));
    notificationRepository.markDeadLetterPublished(
        record.notificationId(), record.retryGeneration(), now);
  }

  private BatchResult drain(
      Function<Integer, List<NotificationRecord>> claimer,
      Consumer<NotificationRecord> publisher,
      Set<UUID> published) {
    int count = 0;
    for (int batch = 0; batch < properties.maxBatchesPerScan(); batch++) {
      final List<NotificationRecord> claimed = claimer.apply(properties.batchSize());
      for (int i = 0; i < claimed.size(); i++) {
        final NotificationRecord record = claimed.get(i);
        if (!published.add(record.notificationId())) {
          continue;
        }
        try {
          publisher.accept(record);
          count++;
        } catch (NotificationQueueException ex) {
          // ブローカー障害中は残りを投入しても失敗するため、claim を戻して次サイクルに任せる
          logger.warn(
              "notification scheduler publish failed id={} status={} retryCount={}",
              record.notificationId(),
              record.status().value(),
              record.retryCount(),
              ex);
          for (NotificationRecord unpublished : claimed.subList(i, claimed.size())) {
            notificationRepository.releaseRequeueClaim(
                unpublished.notificationId(), unpublished.requeuedAt());
          }
          return new BatchResult(count, true);
        }
      }
      if (claimed.size() < properties.batchSize()) {
        break;
      }
    }
    return new BatchResult(count, false);
  }

  public record ScanResult(
      int requeued, int stalePendingRepublished, int deadLettersPublished, boolean aborted) {}

  private record BatchResult(int published, boolean aborted) {
    static final BatchResult SKIPPED = new BatchResult(0, false);
  }
}
