package com.byterox.sentinel.notification.transport;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.exception.TransportException;
import jakarta.mail.Message;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.javamail.JavaMailSender;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmailTransportTest {

    @Mock
    private ObjectProvider<JavaMailSender> senderProvider;

    @Mock
    private JavaMailSender sender;

    private SentinelProperties properties;

    @BeforeEach
    void setUp() {
        properties = new SentinelProperties();
        properties.getNotification().setDryRun(false);
    }

    private EmailTransport transport() {
        return new EmailTransport(senderProvider, properties);
    }

    private static OutboundMessage message(Map<String, Object> options) {
        return OutboundMessage.builder()
                .notificationId("notif_1")
                .type("scan_complete")
                .subject("Scan complete: a.com")
                .body("<p>Score 72</p>")
                .options(options)
                .build();
    }

    private static List<String> addresses(MimeMessage mime, Message.RecipientType type) throws Exception {
        return mime.getRecipients(type) == null ? List.of()
                : Arrays.stream(mime.getRecipients(type)).map(a -> ((InternetAddress) a).getAddress()).toList();
    }

    @Test
    @DisplayName("should split recipient strings and accept lists")
    void recipientParsing() {
        assertThat(EmailTransport.recipients(Map.of("to", "a@x.io, b@x.io,,"), "to"))
                .containsExactly("a@x.io", "b@x.io");
        assertThat(EmailTransport.recipients(Map.of("cc", List.of("c@x.io", " ")), "cc"))
                .containsExactly("c@x.io");
        assertThat(EmailTransport.recipients(Map.of(), "bcc")).isEmpty();
        assertThat(EmailTransport.recipients(null, "to")).isEmpty();
    }

    @Test
    @DisplayName("should send one message with to, cc and bcc recipients")
    void sends() throws Exception {
        when(senderProvider.getIfAvailable()).thenReturn(sender);
        when(sender.createMimeMessage()).thenReturn(new MimeMessage(Session.getInstance(new Properties())));

        StepVerifier.create(transport().deliver(message(Map.of(
                        "to", "sec@x.io",
                        "cc", List.of("ops@x.io"),
                        "bcc", "audit@x.io"))))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        ArgumentCaptor<MimeMessage> sent = ArgumentCaptor.forClass(MimeMessage.class);
        verify(sender).send(sent.capture());
        MimeMessage mime = sent.getValue();
        assertThat(addresses(mime, Message.RecipientType.TO)).containsExactly("sec@x.io");
        assertThat(addresses(mime, Message.RecipientType.CC)).containsExactly("ops@x.io");
        assertThat(addresses(mime, Message.RecipientType.BCC)).containsExactly("audit@x.io");
        assertThat(mime.getSubject()).isEqualTo("Scan complete: a.com");
        assertThat(((InternetAddress) mime.getFrom()[0]).getAddress()).isEqualTo("alerts@byterox.io");
    }

    @Test
    @DisplayName("should use the legacy recipients option when no to is given")
    void legacyRecipients() throws Exception {
        when(senderProvider.getIfAvailable()).thenReturn(sender);
        when(sender.createMimeMessage()).thenReturn(new MimeMessage(Session.getInstance(new Properties())));

        StepVerifier.create(transport().deliver(message(Map.of("recipients", "sec@x.io", "from", "bot@x.io"))))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        ArgumentCaptor<MimeMessage> sent = ArgumentCaptor.forClass(MimeMessage.class);
        verify(sender).send(sent.capture());
        assertThat(addresses(sent.getValue(), Message.RecipientType.TO)).containsExactly("sec@x.io");
        assertThat(((InternetAddress) sent.getValue().getFrom()[0]).getAddress()).isEqualTo("bot@x.io");
    }

    @Test
    @DisplayName("should fail without any recipient")
    void noRecipients() {
        StepVerifier.create(transport().deliver(message(Map.of())))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(TransportException.class)
                        .hasMessage("No email recipients configured"))
                .verify();
    }

    @Test
    @DisplayName("should fail when no mail sender is configured")
    void missingSender() {
        when(senderProvider.getIfAvailable()).thenReturn(null);

        StepVerifier.create(transport().deliver(message(Map.of("to", "sec@x.io"))))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(TransportException.class)
                        .hasMessage("Mail sender not configured"))
                .verify();
    }

    @Test
    @DisplayName("should not touch the mail sender in dry-run mode")
    void dryRun() {
        properties.getNotification().setDryRun(true);

        StepVerifier.create(transport().deliver(message(Map.of("to", "sec@x.io"))))
                .verifyComplete();

        verify(senderProvider, never()).getIfAvailable();
        verify(sender, never()).send(any(MimeMessage.class));
    }
}
