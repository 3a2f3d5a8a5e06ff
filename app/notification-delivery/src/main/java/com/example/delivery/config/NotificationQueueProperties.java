/*
 * どこで: Notification Delivery の設定バインド
 * 何を: primary/dead-letter stream と購読ワーカーの設定を保持する
 * なぜ: 配信キューと再配信制御の窓を環境で調整し、起動時に妥当性を検証するため
 */
package com.example.delivery.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.queue")
@Validated
public record NotificationQueueProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotBlank String deadLetterSubject,
    @NotBlank String deadLetterStream,
    @NotBlank String durable,
    @NotBlank String deliverGroup,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver,
    @NotNull @Positive Integer workers) {

  @AssertTrue(message = "notification.queue.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return isPositiveDuration(duplicateWindow);
  }

  @AssertTrue(message = "notification.queue.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    // ack-wait は再配信猶予なので 0 以下は許容しない。
    return isPositiveDuration(ackWait);
  }

  @AssertTrue(message = "notification.queue.dead-letter-subject must differ from subject")
  public boolean isDeadLetterSubjectDistinct() {
    return subject == null || !subject.equals(deadLetterSubject);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null は @NotNull で検出する前提。
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
