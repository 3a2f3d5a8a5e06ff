/*
 * どこで: Notification Delivery サービス層
 * 何を: 通知の作成/手動リトライ/参照/集計を提供する
 * なぜ: API から状態機械とキュー投入の順序を隠蔽するため
 */
package com.example.delivery.service;

import com.example.delivery.model.DestinationFormat;
import com.example.delivery.model.NotificationChannel;
import com.example.delivery.model.NotificationQueueMessage;
import com.example.delivery.model.NotificationRecord;
import com.example.delivery.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationCommandService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationCommandService.class);

  private final NotificationRepository notificationRepository;
  private final NotificationQueuePublisher queuePublisher;
  private final NotificationStateMachine stateMachine;
  private final Clock clock;

  public NotificationRecord create(NotificationCreateCommand command) {
    validate(command);
    final Instant now = Instant.now(clock);
    final String destination =
        command.channel().destinationRequired() ? command.destination() : blankToNull(command.destination());
    final NotificationRecord record =
        NotificationRecord.newPending(
            UUID.randomUUID(),
            command.userId(),
            command.channel(),
            command.message(),
            destination,
            now);
    notificationRepository.insert(record);
    logger.info(
        "notification created id={} userId={} channel={}",
        record.notificationId(),
        record.userId(),
        record.channel().value());
    publishQuietly(record);
    return record;
  }

  /**
   * 手動リトライ。FAILED_PERMANENTLY(設定により RETRY_SCHEDULED も)を PENDING に戻して再投入する。
   *
   * @throws NotificationNotFoundException 通知が存在しない場合
   * @throws InvalidNotificationTransitionException 状態が許可されない、または配信中の場合
   */
  public NotificationRecord retry(UUID notificationId) {
    final NotificationRecord current = get(notificationId);
    stateMachine.onManualRetry(current);
    final NotificationRecord reset =
        notificationRepository
            .resetForManualRetry(notificationId, current.status(), Instant.now(clock))
            .orElseThrow(
                () ->
                    new InvalidNotificationTransitionException(
                        "notification changed concurrently or is being delivered id="
                            + notificationId));
    logger.info(
        "notification manual retry accepted id={} from={} generation={}",
        notificationId,
        current.status().value(),
        reset.retryGeneration());
    publishQuietly(reset);
    return reset;
  }

  public NotificationRecord get(UUID notificationId) {
    return notificationRepository
        .findById(notificationId)
        .orElseThrow(() -> new NotificationNotFoundException(notificationId));
  }

  public List<NotificationRecord> listByUser(String userId, NotificationChannel channel) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("user_id is required");
    }
    return notificationRepository.findByUserId(userId, channel);
  }

  public Map<String, Long> stats() {
    final Map<String, Long> stats = new LinkedHashMap<>();
    notificationRepository
        .countByStatus()
        .forEach((status, count) -> stats.put(status.value(), count));
    return stats;
  }

  private void publishQuietly(NotificationRecord record) {
    try {
      queuePublisher.publish(
          NotificationQueueMessage.from(record), NotificationQueueMessage.primaryDedupKey(record));
    } catch (NotificationQueueException ex) {
      // PENDING のまま残り、スケジューラの stale pending 掃除で再投入される
      logger.warn(
          "notification publish failed; left pending for sweep id={}", record.notificationId(), ex);
    }
  }

  private void validate(NotificationCreateCommand command) {
    if (command.userId() == null || command.userId().isBlank()) {
      throw new IllegalArgumentException("user_id is required");
    }
    if (command.channel() == null) {
      throw new IllegalArgumentException("channel is required");
    }
    if (command.message() == null || command.message().isBlank()) {
      throw new IllegalArgumentException("message is required");
    }
    if (!DestinationFormat.isValid(command.channel(), command.destination())) {
      throw new IllegalArgumentException(
          command.channel() == NotificationChannel.EMAIL
              ? "invalid email address"
              : "invalid phone number");
    }
  }

  private String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
