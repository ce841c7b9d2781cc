package com.byterox.sentinel.notification.transport;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.domain.model.NotificationChannel;
import com.byterox.sentinel.exception.TransportException;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * HTML email through the configured {@link JavaMailSender}.
 * <p>
 * Options: {@code to}, {@code cc}, {@code bcc} (string or list) and an optional {@code from}.
 */
@Slf4j
@Component
public class EmailTransport implements NotificationTransport {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final SentinelProperties.Notification properties;

    public EmailTransport(ObjectProvider<JavaMailSender> mailSender, SentinelProperties properties) {
        this.mailSender = mailSender;
        this.properties = properties.getNotification();
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.EMAIL;
    }

    @Override
    public Mono<Void> deliver(OutboundMessage message) {
        return Mono.defer(() -> {
            List<String> to = recipients(message.getOptions(), "to");
            if (to.isEmpty()) {
                to = recipients(message.getOptions(), "recipients");
            }
            List<String> cc = recipients(message.getOptions(), "cc");
            List<String> bcc = recipients(message.getOptions(), "bcc");
            if (to.isEmpty() && cc.isEmpty() && bcc.isEmpty()) {
                return Mono.error(new TransportException("email", "No email recipients configured"));
            }

            if (properties.isDryRun()) {
                log.info("DRY_RUN: Would send email {} to {} with subject '{}'",
                        message.getNotificationId(), to, message.getSubject());
                return Mono.empty();
            }

            JavaMailSender sender = mailSender.getIfAvailable();
            if (sender == null) {
                return Mono.error(new TransportException("email", "Mail sender not configured"));
            }
            List<String> finalTo = to;
            return Mono.<Void>fromRunnable(() -> send(sender, message, finalTo, cc, bcc))
                    .subscribeOn(Schedulers.boundedElastic());
        });
    }

    private void send(JavaMailSender sender, OutboundMessage message,
                      List<String> to, List<String> cc, List<String> bcc) {
        try {
            MimeMessage mime = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, "UTF-8");
            String from = message.option("from");
            helper.setFrom(from != null ? from : properties.getFromAddress());
            helper.setTo(to.toArray(new String[0]));
            if (!cc.isEmpty()) {
                helper.setCc(cc.toArray(new String[0]));
            }
            if (!bcc.isEmpty()) {
                helper.setBcc(bcc.toArray(new String[0]));
            }
            helper.setSubject(message.getSubject() != null ? message.getSubject() : message.getType());
            helper.setText(message.getBody(), true);
            sender.send(mime);
            log.debug("Email {} sent to {}", message.getNotificationId(), to);
        } catch (MessagingException | MailException e) {
            throw new TransportException("email", "Email delivery failed: " + e.getMessage(), e);
        }
    }

    static List<String> recipients(Map<String, Object> options, String key) {
        Object value = options != null ? options.get(key) : null;
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> values) {
            return values.stream().map(Object::toString).filter(s -> !s.isBlank()).toList();
        }
        String text = value.toString();
        if (text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
