package com.byterox.sentinel.api.v1;

import com.byterox.sentinel.config.SecurityConfig;
import com.byterox.sentinel.domain.model.Notification;
import com.byterox.sentinel.domain.model.NotificationStatus;
import com.byterox.sentinel.exception.GlobalExceptionHandler;
import com.byterox.sentinel.exception.TemplateException;
import com.byterox.sentinel.notification.NotificationDispatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = NotificationController.class)
@Import({SecurityConfig.class, GlobalExceptionHandler.class})
class NotificationControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private NotificationDispatcher dispatcher;

    @Test
    @DisplayName("should return the recorded notification even when delivery failed")
    void sendReturnsFailedRecord() {
        when(dispatcher.send(eq("scan_complete"), eq("pager"), anyMap(), anyMap()))
                .thenReturn(Mono.just(Notification.builder()
                        .id("notif_1")
                        .type("scan_complete")
                        .channel("pager")
                        .status(NotificationStatus.FAILED)
                        .error("Unknown notification channel: pager")
                        .build()));

        webTestClient.post()
                .uri("/api/v1/notifications/send")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("type", "scan_complete", "channel", "pager", "data", Map.of("target", "a.com")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("FAILED")
                .jsonPath("$.error").isEqualTo("Unknown notification channel: pager");
    }

    @Test
    @DisplayName("should map a missing template to 422")
    void missingTemplate() {
        when(dispatcher.send(anyString(), anyString(), anyMap(), anyMap()))
                .thenReturn(Mono.error(new TemplateException("slack_weekly_digest")));

        webTestClient.post()
                .uri("/api/v1/notifications/send")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("type", "weekly_digest", "channel", "slack"))
                .exchange()
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.error").isEqualTo("template_error");
    }

    @Test
    @DisplayName("should filter history by parsed status")
    void historyFilters() {
        when(dispatcher.getHistory(eq("slack"), isNull(), eq(NotificationStatus.SENT), eq(10)))
                .thenReturn(List.of(Notification.builder().id("notif_1").channel("slack")
                        .status(NotificationStatus.SENT).build()));

        webTestClient.get()
                .uri("/api/v1/notifications/history?channel=slack&status=sent&limit=10")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].id").isEqualTo("notif_1");
    }

    @Test
    @DisplayName("should reject an unknown status filter")
    void rejectsUnknownStatus() {
        webTestClient.get()
                .uri("/api/v1/notifications/history?status=bounced")
                .exchange()
                .expectStatus().isBadRequest();

        verify(dispatcher, never()).getHistory(any(), any(), any(), anyInt());
    }

    @Test
    @DisplayName("should fan out a trigger without a body")
    void triggerWithoutBody() {
        when(dispatcher.processTrigger(eq("scan_complete"), anyMap())).thenReturn(Mono.just(List.of()));

        webTestClient.post()
                .uri("/api/v1/notifications/trigger/scan_complete")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(0);
    }
}
