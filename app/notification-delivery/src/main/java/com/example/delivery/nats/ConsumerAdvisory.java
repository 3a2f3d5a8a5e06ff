/*
 * どこで: Notification Delivery NATS 購読
 * 何を: JetStream consumer advisory の JSON のうち破棄記録に使う項目
 * なぜ: MAX_DELIVERIES と MSG_TERMINATED を同じ形で読むため
 */
package com.example.delivery.nats;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

// reason は MSG_TERMINATED のみ。MAX_DELIVERIES では null
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
record ConsumerAdvisory(String stream, String consumer, Long streamSeq, String reason) {

  boolean hasStreamSeq() {
    return streamSeq != null && streamSeq > 0L;
  }
}
