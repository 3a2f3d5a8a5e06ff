/*
 * どこで: Notification Delivery NATS 送信
 * 何を: 通知メッセージを primary/dead-letter stream へ publish する
 * なぜ: puback を受けた場合のみ投入成功とし、Nats-Msg-Id で重複投入を吸収するため
 */
package com.example.delivery.nats;

import com.example.delivery.config.NotificationQueueProperties;
import com.example.delivery.model.NotificationQueueMessage;
import com.example.delivery.service.NotificationQueueException;
import com.example.delivery.service.NotificationQueuePublisher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "JetStream/ObjectMapper は Spring 管理の共有コンポーネントのため")
public class JetStreamNotificationQueuePublisher implements NotificationQueuePublisher {

  private static final Logger logger =
      LoggerFactory.getLogger(JetStreamNotificationQueuePublisher.class);
  static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  static final String HEADER_RETRY_COUNT = "retry_count";

  private final JetStream jetStream;
  private final NotificationQueueProperties properties;
  private final ObjectMapper objectMapper;

  public JetStreamNotificationQueuePublisher(
      JetStream jetStream, NotificationQueueProperties properties, ObjectMapper objectMapper) {
    this.jetStream = jetStream;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public void publish(NotificationQueueMessage message, String dedupKey) {
    publishTo(properties.subject(), message, dedupKey);
  }

  @Override
  public void publishDeadLetter(NotificationQueueMessage message, String dedupKey) {
    publishTo(properties.deadLetterSubject(), message, dedupKey);
  }

  private void publishTo(String subject, NotificationQueueMessage message, String dedupKey) {
    final byte[] payload = serialize(message);
    final Headers headers = new Headers();
    // 重複排除キーを NATS の標準ヘッダに載せる
    headers.add(HEADER_MESSAGE_ID, dedupKey);
    headers.add(HEADER_RETRY_COUNT, Integer.toString(message.retryCount()));
    final PublishAck ack;
    try {
      ack = jetStream.publish(subject, headers, payload);
    } catch (IOException | JetStreamApiException ex) {
      throw new NotificationQueueException(
          "failed to publish notification subject=" + subject + " msgId=" + dedupKey, ex);
    }
    if (ack == null) {
      throw new NotificationQueueException(
          "puback is missing subject=" + subject + " msgId=" + dedupKey, null);
    }
    if (ack.isDuplicate()) {
      logger.info("notification publish deduplicated subject={} msgId={}", subject, dedupKey);
      return;
    }
    logger.debug(
        "notification published subject={} msgId={} seq={}", subject, dedupKey, ack.getSeqno());
  }

  private byte[] serialize(NotificationQueueMessage message) {
    try {
      return objectMapper.writeValueAsBytes(message);
    } catch (JsonProcessingException ex) {
      throw new NotificationQueueException(
          "failed to serialize notification id=" + message.notificationId(), ex);
    }
  }
}
