/*
 * どこで: Notification Delivery アプリのスモークテスト
 * 何を: Spring コンテキストの起動を確認する
 * なぜ: 主要な構成が破壊されていないことを担保するため
 */
package com.example.delivery;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.delivery.adapter.DeliveryAdapterRegistry;
import com.example.delivery.model.NotificationChannel;
import com.example.delivery.service.LoggingNotificationQueuePublisher;
import com.example.delivery.service.NotificationQueuePublisher;
import com.example.delivery.service.NotificationRetryScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationDeliveryApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private ApplicationContext context;

  @Test
  void contextLoads() {
    assertThat(context.getBean(NotificationQueuePublisher.class))
        .isInstanceOf(LoggingNotificationQueuePublisher.class);
    assertThat(context.getBeansOfType(NotificationRetryScheduler.class)).isEmpty();
    assertThat(context.getBean(DeliveryAdapterRegistry.class).adapterFor(NotificationChannel.IN_APP))
        .isNotNull();
  }
}
