package com.byterox.sentinel.notification.transport;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.domain.model.NotificationChannel;
import com.byterox.sentinel.exception.TransportException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Text message through an HTTP SMS gateway.
 */
@Slf4j
@Component
public class SmsTransport extends AbstractHttpTransport {

    private static final Pattern PHONE_NUMBER = Pattern.compile("^\\+?[\\d\\s\\-()]{10,}$");

    public SmsTransport(WebClient.Builder webClientBuilder, SentinelProperties properties) {
        super(webClientBuilder, properties);
    }

    public static boolean isValidPhoneNumber(String phoneNumber) {
        return phoneNumber != null && PHONE_NUMBER.matcher(phoneNumber).matches();
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.SMS;
    }

    @Override
    @CircuitBreaker(name = "notification-webhook")
    public Mono<Void> deliver(OutboundMessage message) {
        String phoneNumber = message.option("phone_number");
        if (phoneNumber == null || phoneNumber.isBlank()) {
            return Mono.error(new TransportException("sms", "Phone number not configured"));
        }
        if (!isValidPhoneNumber(phoneNumber)) {
            return Mono.error(new TransportException("sms", "Invalid phone number: " + phoneNumber));
        }

        if (properties.isDryRun()) {
            log.info("DRY_RUN: Would send SMS {} to {}: {}", message.getNotificationId(), phoneNumber, message.getBody());
            return Mono.empty();
        }
        String gatewayUrl = properties.getSmsGatewayUrl();
        if (gatewayUrl == null || gatewayUrl.isBlank()) {
            return Mono.error(new TransportException("sms", "SMS gateway URL not configured"));
        }
        return post(gatewayUrl, Map.of("to", phoneNumber, "message", message.getBody()))
                .doOnSuccess(ignored -> log.debug("SMS {} delivered to {}", message.getNotificationId(), phoneNumber));
    }
}
