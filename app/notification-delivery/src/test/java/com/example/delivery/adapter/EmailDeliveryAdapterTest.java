/*
 * どこで: Notification Delivery email アダプタのユニットテスト
 * 何を: mail/send 呼び出しの形と失敗理由の変換を検証する
 * なぜ: プロバイダ障害が retry 対象の DeliveryResult として返ることを担保するため
 */
package com.example.delivery.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.delivery.config.DeliveryAdapterProperties;
import com.example.delivery.model.NotificationChannel;
import com.example.delivery.model.NotificationRecord;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class EmailDeliveryAdapterTest {

  private static final String BASE_URL = "http://mail.test";

  @Test
  void postsMailSendWithBearerAuth() {
    final ClientFixture fixture = createFixture("api-key");
    fixture
        .server()
        .expect(requestTo(BASE_URL + "/v3/mail/send"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer api-key"))
        .andExpect(jsonPath("$.personalizations[0].to[0].email").value("user@example.com"))
        .andExpect(jsonPath("$.from.email").value("noreply@example.com"))
        .andExpect(jsonPath("$.content[0].value").value("your code is 1234"))
        .andRespond(withSuccess());

    final DeliveryResult result = fixture.adapter().deliver(notification("user@example.com"));

    assertThat(result.success()).isTrue();
    fixture.server().verify();
  }

  @Test
  void serverErrorIsRetryableFailure() {
    final ClientFixture fixture = createFixture("api-key");
    fixture.server().expect(requestTo(BASE_URL + "/v3/mail/send")).andRespond(withServerError());

    final DeliveryResult result = fixture.adapter().deliver(notification("user@example.com"));

    assertThat(result.success()).isFalse();
    assertThat(result.error()).isEqualTo("email provider server error status=500");
  }

  @Test
  void rejectedRequestReportsStatus() {
    final ClientFixture fixture = createFixture("api-key");
    fixture
        .server()
        .expect(requestTo(BASE_URL + "/v3/mail/send"))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    final DeliveryResult result = fixture.adapter().deliver(notification("user@example.com"));

    assertThat(result.error()).isEqualTo("email provider rejected request status=401");
  }

  @Test
  void timeoutIsReportedAsTimeout() {
    final ClientFixture fixture = createFixture("api-key");
    fixture
        .server()
        .expect(requestTo(BASE_URL + "/v3/mail/send"))
        .andRespond(
            request -> {
              throw new SocketTimeoutException("Read timed out");
            });

    final DeliveryResult result = fixture.adapter().deliver(notification("user@example.com"));

    assertThat(result.error()).isEqualTo("email provider request timeout");
  }

  @Test
  void invalidDestinationFailsWithoutCallingProvider() {
    final ClientFixture fixture = createFixture("api-key");

    final DeliveryResult result = fixture.adapter().deliver(notification("broken"));

    assertThat(result.error()).isEqualTo("invalid email destination");
    fixture.server().verify();
  }

  @Test
  void notConfiguredWithoutApiKey() {
    assertThat(createFixture(" ").adapter().isConfigured()).isFalse();
    assertThat(createFixture("api-key").adapter().isConfigured()).isTrue();
  }

  private ClientFixture createFixture(String apiKey) {
    final RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final DeliveryAdapterProperties.Email properties =
        new DeliveryAdapterProperties.Email(
            true, BASE_URL, apiKey, "noreply@example.com", "Hello", Duration.ofSeconds(5));
    return new ClientFixture(new EmailDeliveryAdapter(builder.build(), properties), server);
  }

  private NotificationRecord notification(String destination) {
    return NotificationRecord.newPending(
        UUID.randomUUID(),
        "user-1",
        NotificationChannel.EMAIL,
        "your code is 1234",
        destination,
        Instant.parse("2026-03-01T00:00:00Z"));
  }

  private record ClientFixture(EmailDeliveryAdapter adapter, MockRestServiceServer server) {}
}
