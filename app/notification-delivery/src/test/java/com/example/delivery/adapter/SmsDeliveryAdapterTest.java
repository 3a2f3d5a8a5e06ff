/*
 * どこで: Notification Delivery SMS アダプタのユニットテスト
 * 何を: Messages API への form 送信と失敗理由の変換を検証する
 * なぜ: SMS プロバイダの応答差異を配信結果に正しく写すため
 */
package com.example.delivery.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.delivery.config.DeliveryAdapterProperties;
import com.example.delivery.model.NotificationChannel;
import com.example.delivery.model.NotificationRecord;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

class SmsDeliveryAdapterTest {

  private static final String BASE_URL = "http://sms.test";
  private static final String MESSAGES_URL = BASE_URL + "/2010-04-01/Accounts/AC123/Messages.json";

  @Test
  void postsFormWithBasicAuth() {
    final ClientFixture fixture = createFixture();
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("To", "+819012345678");
    form.add("From", "+15005550006");
    form.add("Body", "verify 0000");
    final String basic =
        Base64.getEncoder().encodeToString("AC123:secret".getBytes(StandardCharsets.UTF_8));
    fixture
        .server()
        .expect(requestTo(MESSAGES_URL))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header(HttpHeaders.AUTHORIZATION, "Basic " + basic))
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
        .andExpect(content().formData(form))
        .andRespond(withSuccess("{\"sid\":\"SM1\"}", MediaType.APPLICATION_JSON));

    final DeliveryResult result = fixture.adapter().deliver(notification("+819012345678"));

    assertThat(result.success()).isTrue();
    fixture.server().verify();
  }

  @Test
  void badRequestIsReportedAsRejected() {
    final ClientFixture fixture = createFixture();
    fixture.server().expect(requestTo(MESSAGES_URL)).andRespond(withStatus(HttpStatus.BAD_REQUEST));

    final DeliveryResult result = fixture.adapter().deliver(notification("+819012345678"));

    assertThat(result.success()).isFalse();
    assertThat(result.error()).isEqualTo("sms provider rejected request status=400");
  }

  @Test
  void connectionFailureIsReportedAsUnreachable() {
    final ClientFixture fixture = createFixture();
    fixture
        .server()
        .expect(requestTo(MESSAGES_URL))
        .andRespond(
            request -> {
              throw new ConnectException("Connection refused");
            });

    final DeliveryResult result = fixture.adapter().deliver(notification("+819012345678"));

    assertThat(result.error()).startsWith("sms provider unreachable");
  }

  @Test
  void invalidPhoneFailsWithoutCallingProvider() {
    final ClientFixture fixture = createFixture();

    final DeliveryResult result = fixture.adapter().deliver(notification("090-1234"));

    assertThat(result.error()).isEqualTo("invalid phone destination");
    fixture.server().verify();
  }

  private ClientFixture createFixture() {
    final RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final DeliveryAdapterProperties.Sms properties =
        new DeliveryAdapterProperties.Sms(
            true, BASE_URL, "AC123", "secret", "+15005550006", Duration.ofSeconds(5));
    return new ClientFixture(new SmsDeliveryAdapter(builder.build(), properties), server);
  }

  private NotificationRecord notification(String destination) {
    return NotificationRecord.newPending(
        UUID.randomUUID(),
        "user-2",
        NotificationChannel.SMS,
        "verify 0000",
        destination,
        Instant.parse("2026-03-01T00:00:00Z"));
  }

  private record ClientFixture(SmsDeliveryAdapter adapter, MockRestServiceServer server) {}
}
