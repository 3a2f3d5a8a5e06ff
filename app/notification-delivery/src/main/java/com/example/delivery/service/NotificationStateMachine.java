/*
 * どこで: Notification Delivery サービス層
 * 何を: 配信結果/手動リトライから次の状態を決める純粋な遷移関数
 * なぜ: 遷移規則を永続化や IO から切り離して一箇所で検証するため
 */
package com.example.delivery.service;

import com.example.delivery.config.NotificationDeliveryProperties;
import com.example.delivery.config.NotificationRetryProperties;
import com.example.delivery.model.NotificationRecord;
import com.example.delivery.model.NotificationStatus;
import com.example.delivery.model.NotificationTransition;
import java.time.Instant;
import org.springframework.stereotype.Component;

@Component
public class NotificationStateMachine {

  private final boolean manualRetryFromScheduled;
  private final int errorMessageMaxLength;

  public NotificationStateMachine(
      NotificationRetryProperties retryProperties,
      NotificationDeliveryProperties deliveryProperties) {
    this(retryProperties.manualRetryFromScheduled(), deliveryProperties.errorMessageMaxLength());
  }

  NotificationStateMachine(boolean manualRetryFromScheduled, int errorMessageMaxLength) {
    this.manualRetryFromScheduled = manualRetryFromScheduled;
    this.errorMessageMaxLength = errorMessageMaxLength;
  }

  public NotificationTransition onDeliverySuccess(NotificationRecord record) {
    requireDeliverable(record);
    return new NotificationTransition(
        NotificationStatus.SENT, record.retryCount(), null, null, false);
  }

  /**
   * 配信失敗を反映する。
   *
   * <p>retry_count を 1 進め、上限未満なら RETRY_SCHEDULED、上限到達なら FAILED_PERMANENTLY とする。
   */
  public NotificationTransition onDeliveryFailure(
      NotificationRecord record, String error, Instant now) {
    requireDeliverable(record);
    final int retryCount = record.retryCount() + 1;
    final String lastError = truncateError(error);
    // 待ち時間か上限到達かの判断は backoff 表に一本化する
    return NotificationBackoffPolicy.nextRetryTime(retryCount, now)
        .map(
            nextRetryTime ->
                new NotificationTransition(
                    NotificationStatus.RETRY_SCHEDULED, retryCount, nextRetryTime, lastError, false))
        .orElseGet(
            () ->
                new NotificationTransition(
                    NotificationStatus.FAILED_PERMANENTLY, retryCount, null, lastError, true));
  }

  public NotificationTransition onManualRetry(NotificationRecord record) {
    if (!isManualRetryAllowedFrom(record.status())) {
      throw new InvalidNotificationTransitionException(
          "manual retry is not allowed from status=" + record.status().value()
              + " id=" + record.notificationId());
    }
    return new NotificationTransition(NotificationStatus.PENDING, 0, null, record.lastError(), false);
  }

  public boolean isManualRetryAllowedFrom(NotificationStatus status) {
    return status == NotificationStatus.FAILED_PERMANENTLY
        || (manualRetryFromScheduled && status == NotificationStatus.RETRY_SCHEDULED);
  }

  private void requireDeliverable(NotificationRecord record) {
    if (record.status() != NotificationStatus.PENDING
        && record.status() != NotificationStatus.RETRY_SCHEDULED) {
      throw new InvalidNotificationTransitionException(
          "delivery outcome cannot be applied to status=" + record.status().value()
              + " id=" + record.notificationId());
    }
  }

  private String truncateError(String message) {
    if (message == null || message.isBlank()) {
      return "unknown error";
    }
    if (message.length() <= errorMessageMaxLength) {
      return message;
    }
    return message.substring(0, errorMessageMaxLength);
  }
}
