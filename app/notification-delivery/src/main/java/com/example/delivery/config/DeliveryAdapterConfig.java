/*
 * どこで: Notification Delivery 配信アダプタ設定
 * 何を: チャネルごとのアダプタを組み立て、dispatch 表を Bean として公開する
 * なぜ: プロバイダの有効/無効と timeout を起動時に確定させるため
 */
package com.example.delivery.config;

import com.example.delivery.adapter.DeliveryAdapter;
import com.example.delivery.adapter.DeliveryAdapterRegistry;
import com.example.delivery.adapter.EmailDeliveryAdapter;
import com.example.delivery.adapter.FailureInjectingDeliveryAdapter;
import com.example.delivery.adapter.InAppDeliveryAdapter;
import com.example.delivery.adapter.LoggingDeliveryAdapter;
import com.example.delivery.adapter.SmsDeliveryAdapter;
import com.example.delivery.model.NotificationChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class DeliveryAdapterConfig {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryAdapterConfig.class);

  @Bean
  public DeliveryAdapterRegistry deliveryAdapterRegistry(
      DeliveryAdapterProperties properties,
      NotificationDeliveryProperties deliveryProperties,
      NotificationQueueProperties queueProperties,
      RestClient.Builder restClientBuilder,
      Environment environment) {
    validateLease(properties, deliveryProperties, queueProperties);
    final List<DeliveryAdapter> adapters = new ArrayList<>();
    adapters.add(emailAdapter(properties.email(), restClientBuilder));
    adapters.add(smsAdapter(properties.sms(), restClientBuilder));
    adapters.add(new InAppDeliveryAdapter());
    return new DeliveryAdapterRegistry(decorate(adapters, properties, environment));
  }

  private DeliveryAdapter emailAdapter(
      DeliveryAdapterProperties.Email email, RestClient.Builder restClientBuilder) {
    if (!email.enabled()) {
      logger.info("email provider disabled; using logging adapter");
      return new LoggingDeliveryAdapter(NotificationChannel.EMAIL);
    }
    final RestClient restClient =
        restClientBuilder
            .clone()
            .baseUrl(email.baseUrl())
            .requestFactory(requestFactory(email.timeout()))
            .build();
    return new EmailDeliveryAdapter(restClient, email);
  }

  private DeliveryAdapter smsAdapter(
      DeliveryAdapterProperties.Sms sms, RestClient.Builder restClientBuilder) {
    if (!sms.enabled()) {
      logger.info("sms provider disabled; using logging adapter");
      return new LoggingDeliveryAdapter(NotificationChannel.SMS);
    }
    final RestClient restClient =
        restClientBuilder
            .clone()
            .baseUrl(sms.baseUrl())
            .requestFactory(requestFactory(sms.timeout()))
            .build();
    return new SmsDeliveryAdapter(restClient, sms);
  }

  private List<DeliveryAdapter> decorate(
      List<DeliveryAdapter> adapters, DeliveryAdapterProperties properties, Environment environment) {
    final DeliveryAdapterProperties.FailureInjection injection = properties.failureInjection();
    // 失敗注入は CI/Test 専用。本番プロファイルでは設定されていても無視する
    if (!injection.enabled() || !environment.acceptsProfiles(Profiles.of("ci", "test"))) {
      return adapters;
    }
    logger.warn("delivery failure injection enabled userIdPrefix={}", injection.userIdPrefix());
    final List<DeliveryAdapter> decorated = new ArrayList<>();
    for (DeliveryAdapter adapter : adapters) {
      // in_app は外部トランスポートを持たないため失敗させない
      decorated.add(
          adapter.channel() == NotificationChannel.IN_APP
              ? adapter
              : new FailureInjectingDeliveryAdapter(adapter, injection.userIdPrefix()));
    }
    return decorated;
  }

  private SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(timeout);
    factory.setReadTimeout(timeout);
    return factory;
  }

  // 接続 + 読み取りの最悪値より lease が短いと、配信中に他ワーカーが lease を奪える
  private void validateLease(
      DeliveryAdapterProperties properties,
      NotificationDeliveryProperties deliveryProperties,
      NotificationQueueProperties queueProperties) {
    final Duration worst = maxTimeout(properties).multipliedBy(2);
    if (deliveryProperties.lease().compareTo(worst) <= 0) {
      throw new IllegalStateException(
          "notification.delivery.lease must exceed connect+read adapter timeout lease="
              + deliveryProperties.lease()
              + " adapterWorstCase="
              + worst);
    }
    // ack-wait が lease 以下だと、配信中のメッセージをブローカーが別ワーカーへ再配信する
    if (queueProperties.ackWait().compareTo(deliveryProperties.lease()) <= 0) {
      throw new IllegalStateException(
          "notification.queue.ack-wait must exceed notification.delivery.lease ackWait="
              + queueProperties.ackWait()
              + " lease="
              + deliveryProperties.lease());
    }
  }

  private Duration maxTimeout(DeliveryAdapterProperties properties) {
    final Duration email = properties.email().timeout();
    final Duration sms = properties.sms().timeout();
    return email.compareTo(sms) >= 0 ? email : sms;
  }
}
