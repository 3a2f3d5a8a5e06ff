/*
 * どこで: Notification Delivery API
 * 何を: 通知作成リクエストの入力を保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.example.delivery.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateNotificationRequest(
    @NotBlank(message = "user_id is required") String userId,
    @NotBlank(message = "channel is required") String channel,
    @NotBlank(message = "message is required") String message,
    String destination) {}
