/*
 * どこで: Notification Delivery 配信アダプタ
 * 何を: HTTP メール API (v3 mail/send) で email 通知を送る
 * なぜ: email チャネルの外部送信を RestClient の境界に閉じ込めるため
 */
package com.example.delivery.adapter;

import com.example.delivery.config.DeliveryAdapterProperties;
import com.example.delivery.model.DestinationFormat;
import com.example.delivery.model.NotificationChannel;
import com.example.delivery.model.NotificationRecord;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

public class EmailDeliveryAdapter implements DeliveryAdapter {

  private static final Logger logger = LoggerFactory.getLogger(EmailDeliveryAdapter.class);
  private static final String PROVIDER = "email provider";
  private static final String SEND_PATH = "/v3/mail/send";

  private final RestClient emailRestClient;
  private final DeliveryAdapterProperties.Email properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は共有コンポーネントで防御的コピーが不可能なため")
  public EmailDeliveryAdapter(RestClient emailRestClient, DeliveryAdapterProperties.Email properties) {
    this.emailRestClient = emailRestClient;
    this.properties = properties;
  }

  @Override
  public NotificationChannel channel() {
    return NotificationChannel.EMAIL;
  }

  @Override
  public boolean isConfigured() {
    return hasText(properties.apiKey()) && hasText(properties.fromAddress());
  }

  @Override
  public DeliveryResult deliver(NotificationRecord notification) {
    if (!DestinationFormat.isValid(NotificationChannel.EMAIL, notification.destination())) {
      return DeliveryResult.failed("invalid email destination");
    }
    try {
      emailRestClient
          .post()
          .uri(SEND_PATH)
          .headers(headers -> headers.setBearerAuth(properties.apiKey()))
          .contentType(MediaType.APPLICATION_JSON)
          .body(buildBody(notification))
          .retrieve()
          .toBodilessEntity();
      logger.info("email delivered id={}", notification.notificationId());
      return DeliveryResult.ok();
    } catch (RestClientResponseException ex) {
      logger.warn(
          "email delivery failed id={} status={}",
          notification.notificationId(),
          ex.getStatusCode().value());
      return HttpFailures.fromResponse(PROVIDER, ex);
    } catch (ResourceAccessException ex) {
      logger.warn("email delivery io failure id={}", notification.notificationId(), ex);
      return HttpFailures.fromResourceAccess(PROVIDER, ex);
    } catch (RestClientException ex) {
      logger.warn("email delivery failed id={}", notification.notificationId(), ex);
      return DeliveryResult.failed(PROVIDER + " request failed: " + ex.getMessage());
    }
  }

  private Map<String, Object> buildBody(NotificationRecord notification) {
    return Map.of(
        "personalizations",
        List.of(Map.of("to", List.of(Map.of("email", notification.destination())))),
        "from",
        Map.of("email", properties.fromAddress()),
        "subject",
        properties.subject(),
        "content",
        List.of(Map.of("type", MediaType.TEXT_PLAIN_VALUE, "value", notification.message())));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
