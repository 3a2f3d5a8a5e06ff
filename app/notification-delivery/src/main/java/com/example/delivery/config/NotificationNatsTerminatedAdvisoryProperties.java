/*
 * どこで: Notification Delivery の設定バインド
 * 何を: JetStream TERMINATED advisory 購読設定を保持する
 * なぜ: term された不正メッセージの stream_seq を保存するため
 */
package com.example.delivery.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.nats.terminated-advisory")
@Validated
public record NotificationNatsTerminatedAdvisoryProperties(
    @NotBlank String subject, @NotBlank String stream, @NotBlank String durable) {}
