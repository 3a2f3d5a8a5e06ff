/*
 * どこで: Notification Delivery NATS 購読
 * 何を: advisory が指す stream_seq の本文を引き直し、通知 ID 付きで破棄記録を残す
 * なぜ: ブローカーが手放した配信を notification_id 単位で調べられるようにするため
 */
package com.example.delivery.nats;

import com.example.delivery.config.NotificationQueueProperties;
import com.example.delivery.model.BrokerDroppedMessage;
import com.example.delivery.model.NotificationQueueMessage;
import com.example.delivery.repository.NotificationNatsDlqRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.MessageInfo;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
class BrokerDropRecorder {

  private static final Logger logger = LoggerFactory.getLogger(BrokerDropRecorder.class);

  /** advisory メッセージをどう決着させるか。 */
  enum Settlement {
    ACK,
    NAK
  }

  private final Connection connection;
  private final NotificationQueueProperties queueProperties;
  private final NotificationNatsDlqRepository dlqRepository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  BrokerDropRecorder(
      Connection connection,
      NotificationQueueProperties queueProperties,
      NotificationNatsDlqRepository dlqRepository,
      ObjectMapper objectMapper,
      Clock clock) {
    this.connection = connection;
    this.queueProperties = queueProperties;
    this.dlqRepository = dlqRepository;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  Settlement record(String kind, byte[] payload) {
    final ConsumerAdvisory advisory;
    try {
      advisory = objectMapper.readValue(payload, ConsumerAdvisory.class);
    } catch (IOException ex) {
      // 不正 JSON は再配信しても回復しない
      logger.warn("failed to parse {} advisory payload", kind, ex);
      return Settlement.ACK;
    }
    if (advisory == null || !advisory.hasStreamSeq()) {
      logger.warn("{} advisory payload missing stream_seq", kind);
      return Settlement.ACK;
    }

    final long streamSeq = advisory.streamSeq();
    final String stream =
        advisory.stream() == null || advisory.stream().isBlank()
            ? queueProperties.stream()
            : advisory.stream();
    final Optional<NotificationQueueMessage> dropped;
    try {
      dropped = lookupDropped(kind, stream, streamSeq);
    } catch (IOException ex) {
      logger.warn("failed to fetch dropped message kind={} stream={} streamSeq={}",
          kind, stream, streamSeq, ex);
      return Settlement.NAK;
    }

    final BrokerDroppedMessage entry =
        new BrokerDroppedMessage(
            streamSeq,
            kind,
            dropped.map(NotificationQueueMessage::notificationId).orElse(null),
            dropped.map(NotificationQueueMessage::retryCount).orElse(null),
            advisory.reason(),
            Instant.now(clock));
    try {
      if (dlqRepository.insert(entry)) {
        logger.warn("notification message dropped by broker kind={} streamSeq={} notificationId={} retryCount={}",
            kind, streamSeq, entry.notificationId(), entry.retryCount());
      } else {
        logger.info("broker drop already recorded kind={} streamSeq={}", kind, streamSeq);
      }
      return Settlement.ACK;
    } catch (DataAccessException ex) {
      // DB 復旧後に advisory の再配信で記録し直す
      logger.warn("temporary failure while recording broker drop kind={} streamSeq={}",
          kind, streamSeq, ex);
      return Settlement.NAK;
    }
  }

  private Optional<NotificationQueueMessage> lookupDropped(String kind, String stream, long streamSeq)
      throws IOException {
    try {
      final MessageInfo info = connection.jetStreamManagement().getMessage(stream, streamSeq);
      final byte[] data = info == null ? null : info.getData();
      if (data == null || data.length == 0) {
        return Optional.empty();
      }
      return Optional.of(objectMapper.readValue(data, NotificationQueueMessage.class));
    } catch (JetStreamApiException ex) {
      // 保持期限切れ等で本文が消えていれば stream_seq だけ残す
      logger.warn("dropped message no longer in stream kind={} stream={} streamSeq={} code={}",
          kind, stream, streamSeq, ex.getApiErrorCode());
      return Optional.empty();
    } catch (JsonProcessingException ex) {
      // TERM の多くは本文不正が原因なので、読めなくても記録は残す
      logger.warn("dropped message body unreadable kind={} stream={} streamSeq={}",
          kind, stream, streamSeq, ex);
      return Optional.empty();
    }
  }
}
