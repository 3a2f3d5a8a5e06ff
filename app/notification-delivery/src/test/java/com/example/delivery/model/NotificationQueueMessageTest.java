/*
 * どこで: Notification Delivery キューメッセージのユニットテスト
 * 何を: JSON 表現と重複排除キーの形式を検証する
 * なぜ: ワーカーとスケジューラ間のワイヤ形式を固定するため
 */
package com.example.delivery.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class NotificationQueueMessageTest {

  private static final UUID ID = UUID.fromString("0b6f6a4e-51c5-4e0e-9d3c-2f1f5c0d8a11");

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void serializesWithSnakeCaseAndLowercaseChannel() throws Exception {
    final NotificationQueueMessage message =
        new NotificationQueueMessage(ID, "user-9", NotificationChannel.IN_APP, "badge", null, 2);

    final JsonNode json = objectMapper.readTree(objectMapper.writeValueAsBytes(message));

    assertThat(json.get("notification_id").asText()).isEqualTo(ID.toString());
    assertThat(json.get("user_id").asText()).isEqualTo("user-9");
    assertThat(json.get("channel").asText()).isEqualTo("in_app");
    assertThat(json.get("retry_count").asInt()).isEqualTo(2);
  }

  @Test
  void deserializesChannelValue() throws Exception {
    final String json =
        "{\"notification_id\":\"" + ID + "\",\"user_id\":\"u\",\"channel\":\"sms\","
            + "\"message\":\"m\",\"destination\":\"+819012345678\",\"retry_count\":1}";

    final NotificationQueueMessage message =
        objectMapper.readValue(json, NotificationQueueMessage.class);

    assertThat(message.channel()).isEqualTo(NotificationChannel.SMS);
    assertThat(message.retryCount()).isEqualTo(1);
  }

  @Test
  void dedupKeysIncludeGenerationAndRetryCount() {
    final NotificationRecord record =
        new NotificationRecord(
            ID,
            "user-9",
            NotificationChannel.EMAIL,
            "m",
            "a@example.com",
            NotificationStatus.RETRY_SCHEDULED,
            3,
            Instant.parse("2026-03-01T00:10:00Z"),
            "timeout",
            2,
            null,
            null,
            null,
            Instant.parse("2026-03-01T00:00:00Z"),
            Instant.parse("2026-03-01T00:00:00Z"),
            null,
            null);

    assertThat(NotificationQueueMessage.primaryDedupKey(record)).isEqualTo(ID + ".2.3");
    assertThat(NotificationQueueMessage.deadLetterDedupKey(record)).isEqualTo("dlq." + ID + ".2");
    assertThat(NotificationQueueMessage.from(record).withRetryCount(4).retryCount()).isEqualTo(4);
  }
}
