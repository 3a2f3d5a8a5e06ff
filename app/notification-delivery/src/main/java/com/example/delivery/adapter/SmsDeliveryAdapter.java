/*
 * どこで: Notification Delivery 配信アダプタ
 * 何を: Messages API (Twilio 互換) で SMS 通知を送る
 * なぜ: sms チャネルの外部送信を RestClient の境界に閉じ込めるため
 */
package com.example.delivery.adapter;

import com.example.delivery.config.DeliveryAdapterProperties;
import com.example.delivery.model.DestinationFormat;
import com.example.delivery.model.NotificationChannel;
import com.example.delivery.model.NotificationRecord;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

public class SmsDeliveryAdapter implements DeliveryAdapter {

  private static final Logger logger = LoggerFactory.getLogger(SmsDeliveryAdapter.class);
  private static final String PROVIDER = "sms provider";
  private static final String MESSAGES_PATH = "/2010-04-01/Accounts/{accountSid}/Messages.json";

  private final RestClient smsRestClient;
  private final DeliveryAdapterProperties.Sms properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は共有コンポーネントで防御的コピーが不可能なため")
  public SmsDeliveryAdapter(RestClient smsRestClient, DeliveryAdapterProperties.Sms properties) {
    this.smsRestClient = smsRestClient;
    this.properties = properties;
  }

  @Override
  public NotificationChannel channel() {
    return NotificationChannel.SMS;
  }

  @Override
  public boolean isConfigured() {
    return hasText(properties.accountSid())
        && hasText(properties.authToken())
        && hasText(properties.fromNumber());
  }

  @Override
  public DeliveryResult deliver(NotificationRecord notification) {
    if (!DestinationFormat.isValid(NotificationChannel.SMS, notification.destination())) {
      return DeliveryResult.failed("invalid phone destination");
    }
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("To", notification.destination());
    form.add("From", properties.fromNumber());
    form.add("Body", notification.message());
    try {
      smsRestClient
          .post()
          .uri(MESSAGES_PATH, properties.accountSid())
          .headers(headers -> headers.setBasicAuth(properties.accountSid(), properties.authToken()))
          .contentType(MediaType.APPLICATION_FORM_URLENCODED)
          .body(form)
          .retrieve()
          .toBodilessEntity();
      logger.info("sms delivered id={}", notification.notificationId());
      return DeliveryResult.ok();
    } catch (RestClientResponseException ex) {
      logger.warn(
          "sms delivery failed id={} status={}",
          notification.notificationId(),
          ex.getStatusCode().value());
      return HttpFailures.fromResponse(PROVIDER, ex);
    } catch (ResourceAccessException ex) {
      logger.warn("sms delivery io failure id={}", notification.notificationId(), ex);
      return HttpFailures.fromResourceAccess(PROVIDER, ex);
    } catch (RestClientException ex) {
      logger.warn("sms delivery failed id={}", notification.notificationId(), ex);
      return DeliveryResult.failed(PROVIDER + " request failed: " + ex.getMessage());
    }
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
