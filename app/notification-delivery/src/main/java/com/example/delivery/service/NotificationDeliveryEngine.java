/*
 * どこで: Notification Delivery サービス層
 * 何を: キューから受け取った 1 通知を配信し、結果を状態機械経由で永続化する
 * なぜ: lease + CAS で単一書き込みを保ちつつ、at-least-once の重複を無害化するため
 */
package com.example.delivery.service;

import com.example.common.WorkerIds;
import com.example.delivery.adapter.DeliveryAdapter;
import com.example.delivery.adapter.DeliveryAdapterRegistry;
import com.example.delivery.adapter.DeliveryResult;
import com.example.delivery.config.NotificationDeliveryProperties;
import com.example.delivery.model.NotificationQueueMessage;
import com.example.delivery.model.NotificationRecord;
import com.example.delivery.model.NotificationStatus;
import com.example.delivery.model.NotificationTransition;
import com.example.delivery.repository.NotificationRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationDeliveryEngine {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryEngine.class);
    static final String MDC_NOTIFICATION_ID = "notification_id";

    private final NotificationRepository notificationRepository;
    private final DeliveryAdapterRegistry adapterRegistry;
    private final NotificationStateMachine stateMachine;
    private final NotificationQueuePublisher queuePublisher;
    private final NotificationMetrics metrics;
    private final NotificationDeliveryProperties properties;
    private final Clock clock;

    public DeliveryOutcome process(NotificationQueueMessage message) {
        if (message == null || message.notificationId() == null) {
            throw new NotificationMessagePermanentException("notification_id is missing");
        }
        UUID notificationId = message.notificationId();
        MDC.put(MDC_NOTIFICATION_ID, notificationId.toString());
        try {
            NotificationRecord record = notificationRepository.findById(notificationId)
                    .orElseThrow(() -> new NotificationMessagePermanentException(
                            "unknown notification id=" + notificationId));
            if (record.status().isTerminal()) {
                // 重複配信: 終端状態は一切変更しない
                logger.info("notification already terminal id={} status={}",
                        notificationId, record.status().value());
                return DeliveryOutcome.SKIPPED_TERMINAL;
            }
            if (isStale(record, message)) {
                logger.info("stale notification message skipped id={} status={} recordRetryCount={} messageRetryCount={}",
                        notificationId,
                        record.status().value(),
                        record.retryCount(),
                        message.retryCount());
                return DeliveryOutcome.SKIPPED_STALE;
            }
            Instant now = Instant.now(clock);
            String lockedBy = resolveLockedBy();
            int claimed = notificationRepository.claimForDelivery(
                    notificationId,
                    record.status(),
                    record.retryCount(),
                    lockedBy,
                    now,
                    now.plus(properties.lease()));
            if (claimed == 0) {
                logger.info("notification delivery lease held elsewhere id={}", notificationId);
                return DeliveryOutcome.IN_FLIGHT_ELSEWHERE;
            }
            try {
                DeliveryResult result = dispatch(record);
                return applyResult(record, message, result, lockedBy);
            } catch (RuntimeException ex) {
                // ストア/ブローカー障害は配信失敗として記録せず、lease を返して再配信に委ねる
                releaseLeaseQuietly(notificationId, lockedBy);
                throw ex;
            }
        } finally {
            MDC.remove(MDC_NOTIFICATION_ID);
        }
    }

    private boolean isStale(NotificationRecord record, NotificationQueueMessage message) {
        if (record.retryCount() != message.retryCount()) {
            return true;
        }
        // RETRY_SCHEDULED はスケジューラが claim した後の投入だけを受け付ける
        return record.status() == NotificationStatus.RETRY_SCHEDULED && record.requeuedAt() == null;
    }

    private DeliveryResult dispatch(NotificationRecord record) {
        DeliveryAdapter adapter = adapterRegistry.adapterFor(record.channel());
        try {
            DeliveryResult result = adapter.deliver(record);
            return result == null ? DeliveryResult.failed("adapter returned no result") : result;
        } catch (RuntimeException ex) {
            // アダプタの想定外例外も配信失敗として扱う
            logger.warn("delivery adapter threw id={} channel={}",
                    record.notificationId(), record.channel().value(), ex);
            return DeliveryResult.failed(ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }

    private DeliveryOutcome applyResult(NotificationRecord record,
            NotificationQueueMessage message,
            DeliveryResult result,
            String lockedBy) {
        Instant completedAt = Instant.now(clock);
        if (result.success()) {
            NotificationTransition sent = stateMachine.onDeliverySuccess(record);
            int updated = notificationRepository.markSent(record, sent, lockedBy, completedAt);
            if (updated == 0) {
                logger.warn("notification sent but lease was lost id={}", record.notificationId());
                return DeliveryOutcome.LEASE_LOST;
            }
            metrics.recordDeliveryResult(record.channel(), "success");
            metrics.recordDeliveryE2eDelay(record.createdAt(), completedAt);
            logger.info("notification sent id={} channel={} retryCount={}",
                    record.notificationId(), record.channel().value(), record.retryCount());
            return DeliveryOutcome.SENT;
        }

        NotificationTransition transition =
                stateMachine.onDeliveryFailure(record, result.error(), completedAt);
        if (!transition.deadLetter()) {
            int updated = notificationRepository.markRetryScheduled(record, transition, lockedBy, completedAt);
            if (updated == 0) {
                logger.warn("notification retry skipped because lease was lost id={} retryCount={}",
                        record.notificationId(), transition.retryCount());
                return DeliveryOutcome.LEASE_LOST;
            }
            metrics.recordDeliveryResult(record.channel(), "retry");
            logger.warn("notification retry scheduled id={} channel={} retryCount={} nextRetryTime={} error={}",
                    record.notificationId(),
                    record.channel().value(),
                    transition.retryCount(),
                    transition.nextRetryTime(),
                    transition.lastError());
            return DeliveryOutcome.RETRY_SCHEDULED;
        }

        // 終端化を先に確定させる。dead-letter 投入はその後で、失敗してもスケジューラが拾い直す
        int updated = notificationRepository.markFailedPermanently(record, transition, lockedBy, completedAt);
        if (updated == 0) {
            logger.warn("notification dead-letter skipped because lease was lost id={}", record.notificationId());
            return DeliveryOutcome.LEASE_LOST;
        }
        metrics.recordDlqMoved();
        metrics.recordDeliveryResult(record.channel(), "dead_letter");
        logger.warn("notification failed permanently id={} channel={} retryCount={} error={}",
                record.notificationId(),
                record.channel().value(),
                transition.retryCount(),
                transition.lastError());
        publishDeadLetterQuietly(record, message.withRetryCount(transition.retryCount()));
        return DeliveryOutcome.DEAD_LETTERED;
    }

    private void publishDeadLetterQuietly(NotificationRecord record, NotificationQueueMessage deadLetter) {
        try {
            queuePublisher.publishDeadLetter(deadLetter, NotificationQueueMessage.deadLetterDedupKey(record));
            notificationRepository.markDeadLetterPublished(
                    record.notificationId(), record.retryGeneration(), Instant.now(clock));
        } catch (NotificationQueueException | DataAccessException ex) {
            // 行は FAILED_PERMANENTLY で確定済み。未投入分はスケジューラの outbox 掃除で再投入される
            logger.warn("dead-letter publish deferred to retry scheduler id={} generation={}",
                    record.notificationId(), record.retryGeneration(), ex);
        }
    }

    private void releaseLeaseQuietly(UUID notificationId, String lockedBy) {
        try {
            notificationRepository.releaseLease(notificationId, lockedBy);
        } catch (RuntimeException ex) {
            // lease は期限切れで自然に解放される
            logger.warn("failed to release delivery lease id={} lockedBy={}", notificationId, lockedBy, ex);
        }
    }

    @VisibleForTesting
    String resolveLockedBy() {
        // dispatcher スレッドごとに所有者を分ける
        return WorkerIds.workerId(Thread.currentThread().getName());
    }
}
