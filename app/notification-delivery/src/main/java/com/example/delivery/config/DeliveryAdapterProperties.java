/*
 * Where: Notification Delivery configuration binding
 * What: Holds email/SMS provider endpoints, credentials and timeouts
 * Why: Keep provider wiring and the bounded adapter timeout tunable per environment
 */
package com.example.delivery.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.adapters")
@Validated
public record DeliveryAdapterProperties(
    @Valid @NotNull Email email,
    @Valid @NotNull Sms sms,
    @Valid @NotNull FailureInjection failureInjection) {

  public record Email(
      boolean enabled,
      String baseUrl,
      String apiKey,
      String fromAddress,
      String subject,
      @NotNull Duration timeout) {

    public Email {
      baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.sendgrid.com" : baseUrl;
      subject = subject == null || subject.isBlank() ? "Notification" : subject;
    }
  }

  public record Sms(
      boolean enabled,
      String baseUrl,
      String accountSid,
      String authToken,
      String fromNumber,
      @NotNull Duration timeout) {

    public Sms {
      baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.twilio.com" : baseUrl;
    }
  }

  public record FailureInjection(boolean enabled, String userIdPrefix) {}
}
