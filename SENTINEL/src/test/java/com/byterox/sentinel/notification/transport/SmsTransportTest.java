package com.byterox.sentinel.notification.transport;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.exception.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class SmsTransportTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private SentinelProperties properties;

    @BeforeEach
    void setUp() {
        properties = new SentinelProperties();
        properties.getNotification().setDryRun(false);
        properties.getNotification().setSmsGatewayUrl("http://sms.local/send");
    }

    private SmsTransport transport() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(HttpStatus.ACCEPTED).build());
        });
        return new SmsTransport(builder, properties);
    }

    private static OutboundMessage message(Map<String, Object> options) {
        return OutboundMessage.builder()
                .notificationId("notif_1")
                .type("vulnerability_alert")
                .body("ALERT a.com score 42%")
                .options(options)
                .build();
    }

    @Test
    @DisplayName("should accept international and formatted phone numbers")
    void phoneNumbers() {
        assertThat(SmsTransport.isValidPhoneNumber("+1 (555) 123-4567")).isTrue();
        assertThat(SmsTransport.isValidPhoneNumber("0612345678")).isTrue();
        assertThat(SmsTransport.isValidPhoneNumber("12345")).isFalse();
        assertThat(SmsTransport.isValidPhoneNumber("call me maybe")).isFalse();
        assertThat(SmsTransport.isValidPhoneNumber(null)).isFalse();
    }

    @Test
    @DisplayName("should post the message to the gateway")
    void posts() {
        StepVerifier.create(transport().deliver(message(Map.of("phone_number", "+15551234567"))))
                .verifyComplete();

        assertThat(requests).singleElement()
                .satisfies(request -> assertThat(request.url().toString()).isEqualTo("http://sms.local/send"));
    }

    @Test
    @DisplayName("should reject a missing or malformed phone number before calling out")
    void badRecipient() {
        StepVerifier.create(transport().deliver(message(Map.of())))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(TransportException.class)
                        .hasMessage("Phone number not configured"))
                .verify();
        StepVerifier.create(transport().deliver(message(Map.of("phone_number", "555-12"))))
                .expectErrorSatisfies(error -> assertThat(error)
                        .hasMessage("Invalid phone number: 555-12"))
                .verify();

        assertThat(requests).isEmpty();
    }

    @Test
    @DisplayName("should fail without a gateway URL outside dry-run mode")
    void missingGateway() {
        properties.getNotification().setSmsGatewayUrl(null);

        StepVerifier.create(transport().deliver(message(Map.of("phone_number", "+15551234567"))))
                .expectErrorSatisfies(error -> assertThat(error).hasMessage("SMS gateway URL not configured"))
                .verify();
    }

    @Test
    @DisplayName("should not call the gateway in dry-run mode")
    void dryRun() {
        properties.getNotification().setDryRun(true);
        properties.getNotification().setSmsGatewayUrl(null);

        StepVerifier.create(transport().deliver(message(Map.of("phone_number", "+15551234567"))))
                .verifyComplete();

        assertThat(requests).isEmpty();
    }
}
