/*
 * どこで: Notification Delivery の設定バインド
 * 何を: JetStream MaxDeliver advisory 購読設定を保持する
 * なぜ: 再配信上限に達した配信メッセージを追跡できるようにするため
 */
package com.example.delivery.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.nats.advisory")
@Validated
public record NotificationNatsAdvisoryProperties(
    @NotBlank String subject, @NotBlank String stream, @NotBlank String durable) {}
