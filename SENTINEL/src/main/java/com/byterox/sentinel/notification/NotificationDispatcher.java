package com.byterox.sentinel.notification;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.domain.model.ChannelTarget;
import com.byterox.sentinel.domain.model.Notification;
import com.byterox.sentinel.domain.model.NotificationChannel;
import com.byterox.sentinel.domain.model.NotificationRule;
import com.byterox.sentinel.domain.model.NotificationStats;
import com.byterox.sentinel.domain.model.NotificationStatus;
import com.byterox.sentinel.domain.repository.HistoryStore;
import com.byterox.sentinel.domain.repository.NotificationRuleRepository;
import com.byterox.sentinel.exception.NotFoundException;
import com.byterox.sentinel.exception.TemplateException;
import com.byterox.sentinel.exception.ValidationException;
import com.byterox.sentinel.kafka.AutomationEventProducer;
import com.byterox.sentinel.notification.template.NotificationTemplate;
import com.byterox.sentinel.notification.template.RenderedMessage;
import com.byterox.sentinel.notification.template.TemplateRegistry;
import com.byterox.sentinel.notification.transport.NotificationTransport;
import com.byterox.sentinel.notification.transport.OutboundMessage;
import com.byterox.sentinel.observability.SentinelMetrics;
import com.byterox.sentinel.observability.SentinelStructuredLogger;
import com.byterox.sentinel.observability.SentinelStructuredLogger.NotificationEventType;
import com.byterox.sentinel.rules.ConditionEvaluator;
import com.byterox.sentinel.rules.RuleValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Renders templates and hands them to channel transports.
 * <p>
 * Every attempt, delivered or not, is appended to the notification history. Transport
 * failures are recorded as {@link NotificationStatus#FAILED} and never retried. A missing
 * template is recorded too, but surfaces as a {@link TemplateException} so the caller can
 * decide how to react.
 */
@Slf4j
@Service
public class NotificationDispatcher {

    public static final String TEST_TYPE = "test";

    private final TemplateRegistry templates;
    private final Map<NotificationChannel, NotificationTransport> transports;
    private final NotificationRuleRepository ruleRepository;
    private final HistoryStore historyStore;
    private final AutomationEventProducer eventProducer;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final SentinelProperties.Notification properties;
    private final Clock clock;

    public NotificationDispatcher(TemplateRegistry templates,
                                  List<NotificationTransport> transports,
                                  NotificationRuleRepository ruleRepository,
                                  HistoryStore historyStore,
                                  AutomationEventProducer eventProducer,
                                  SentinelMetrics metrics,
                                  SentinelStructuredLogger structuredLogger,
                                  SentinelProperties properties,
                                  Clock clock) {
        this.templates = templates;
        this.transports = new EnumMap<>(NotificationChannel.class);
        transports.forEach(transport -> this.transports.put(transport.channel(), transport));
        this.ruleRepository = ruleRepository;
        this.historyStore = historyStore;
        this.eventProducer = eventProducer;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.properties = properties.getNotification();
        this.clock = clock;
    }

    // ========== Sending ==========

    /**
     * Render the {@code channel_type} template against {@code data} and deliver it.
     *
     * @return the recorded notification, SENT or FAILED; errors only with {@link TemplateException}
     */
    public Mono<Notification> send(String type, String channel, Map<String, Object> data,
                                   Map<String, Object> options) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            Map<String, Object> payload = data != null ? new HashMap<>(data) : new HashMap<>();
            Notification pending = Notification.builder()
                    .id("notif_" + UUID.randomUUID())
                    .type(type)
                    .channel(channel)
                    .status(NotificationStatus.PENDING)
                    .payload(payload)
                    .createdAt(now)
                    .build();

            Optional<NotificationChannel> resolved = NotificationChannel.fromValue(channel);
            if (resolved.isEmpty() || !transports.containsKey(resolved.get())) {
                return Mono.just(recordFailed(pending, "Unknown notification channel: " + channel));
            }

            String key = TemplateRegistry.keyOf(resolved.get().value(), type);
            Optional<NotificationTemplate> template = templates.find(resolved.get().value(), type);
            if (template.isEmpty()) {
                structuredLogger.logNotificationEvent(pending.getId(), NotificationEventType.TEMPLATE_MISSING,
                        "No template for " + key, Map.of("channel", String.valueOf(channel), "type", String.valueOf(type)));
                recordFailed(pending, "Template not found: " + key);
                return Mono.error(new TemplateException(key));
            }

            RenderedMessage rendered = template.get().render(renderData(payload, now));
            Notification rendering = pending.toBuilder()
                    .subject(rendered.subject())
                    .message(rendered.body())
                    .build();
            OutboundMessage outbound = OutboundMessage.builder()
                    .notificationId(rendering.getId())
                    .type(type)
                    .subject(rendered.subject())
                    .body(rendered.body())
                    .data(payload)
                    .options(options != null ? options : Map.of())
                    .createdAt(now)
                    .build();

            return transports.get(resolved.get()).deliver(outbound)
                    .then(Mono.fromCallable(() -> recordSent(rendering)))
                    .onErrorResume(error -> !(error instanceof TemplateException),
                            error -> Mono.just(recordFailed(rendering, error.getMessage())));
        });
    }

    /**
     * Send the {@code test} type with sample data.
     */
    public Mono<Notification> sendTest(String channel, Map<String, Object> options) {
        Map<String, Object> data = new HashMap<>();
        data.put("source", "ByteRox Sentinel");
        data.put("target", "example.com");
        data.put("timestamp", clock.instant().toString());
        data.put("message", "Notification channel test");
        return send(TEST_TYPE, channel, data, options);
    }

    /**
     * Fan out a trigger to every enabled notification rule whose conditions hold on {@code data}.
     * A rule's counter increments once per evaluation, independent of its channel count.
     */
    public Mono<List<Notification>> processTrigger(String triggerType, Map<String, Object> data) {
        return Flux.defer(() -> Flux.fromIterable(ruleRepository.findAll()))
                .filter(rule -> rule.isEnabled() && triggerType != null && triggerType.equals(rule.getTrigger()))
                .filter(rule -> ConditionEvaluator.evaluateAll(rule.getConditions(), data))
                .concatMap(rule -> {
                    markTriggered(rule.getId());
                    log.debug("Notification rule {} matched trigger {}", rule.getId(), triggerType);
                    return Flux.fromIterable(rule.getChannels())
                            .concatMap(target -> send(triggerType, target.getChannel(), data, target.getOptions())
                                    .onErrorResume(TemplateException.class, error -> {
                                        log.warn("Notification rule {} skipped channel {}: {}",
                                                rule.getId(), target.getChannel(), error.getMessage());
                                        return Mono.empty();
                                    }));
                })
                .collectList();
    }

    // ========== History ==========

    public List<Notification> getHistory(String channel, String type, NotificationStatus status, int limit) {
        Predicate<Notification> filter = notification ->
                (channel == null || channel.equals(notification.getChannel()))
                        && (type == null || type.equals(notification.getType()))
                        && (status == null || status == notification.getStatus());
        return historyStore.findNotifications(filter, limit);
    }

    public NotificationStats getStats() {
        List<Notification> all = historyStore.findNotifications(notification -> true, Integer.MAX_VALUE);
        return NotificationStats.builder()
                .total(all.size())
                .sent(count(all, NotificationStatus.SENT))
                .failed(count(all, NotificationStatus.FAILED))
                .pending(count(all, NotificationStatus.PENDING))
                .byChannel(breakdown(all, Notification::getChannel))
                .byType(breakdown(all, Notification::getType))
                .build();
    }

    // ========== Notification Rules ==========

    public List<NotificationRule> listRules() {
        return ruleRepository.findAll().stream()
                .sorted(Comparator.comparing(NotificationRule::getCreatedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    public NotificationRule getRule(String id) {
        return ruleRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Notification rule", id));
    }

    public NotificationRule createRule(NotificationRule rule) {
        validateRule(rule);
        rule.setId(rule.getId() != null && !rule.getId().isBlank() ? rule.getId() : UUID.randomUUID().toString());
        rule.setTriggeredCount(0);
        rule.setLastTriggeredAt(null);
        rule.setCreatedAt(clock.instant());
        log.info("Created notification rule {} ({}) for trigger {}", rule.getId(), rule.getName(), rule.getTrigger());
        return ruleRepository.save(rule);
    }

    public void deleteRule(String id) {
        if (!ruleRepository.delete(id)) {
            throw new NotFoundException("Notification rule", id);
        }
        log.info("Deleted notification rule {}", id);
    }

    void validateRule(NotificationRule rule) {
        if (rule == null) {
            throw ValidationException.of("notification rule", List.of("rule is required"));
        }
        List<String> errors = new ArrayList<>();
        if (RuleValidator.isBlank(rule.getName())) {
            errors.add("name is required");
        }
        if (RuleValidator.isBlank(rule.getTrigger())) {
            errors.add("trigger is required");
        }
        if (rule.getChannels() == null || rule.getChannels().isEmpty()) {
            errors.add("at least one channel is required");
        } else {
            for (int i = 0; i < rule.getChannels().size(); i++) {
                ChannelTarget target = rule.getChannels().get(i);
                if (target == null || NotificationChannel.fromValue(target.getChannel()).isEmpty()) {
                    errors.add("channels[" + i + "].channel '" + (target != null ? target.getChannel() : null)
                            + "' is not a known channel");
                }
            }
        }
        if (rule.getConditions() != null) {
            for (int i = 0; i < rule.getConditions().size(); i++) {
                RuleValidator.validateCondition(rule.getConditions().get(i), "conditions[" + i + "]", false, errors);
            }
        }
        if (!errors.isEmpty()) {
            throw ValidationException.of("notification rule", errors);
        }
    }

    // ========== Private Methods ==========

    private Map<String, Object> renderData(Map<String, Object> payload, Instant now) {
        Map<String, Object> data = new HashMap<>();
        data.put("dashboard_url", properties.getDashboardUrl());
        data.put("timestamp", now.toString());
        data.put("detected_at", now.toString());
        data.putAll(payload);
        return data;
    }

    private void markTriggered(String ruleId) {
        Instant now = clock.instant();
        ruleRepository.update(ruleId, rule -> {
            rule.setTriggeredCount(rule.getTriggeredCount() + 1);
            rule.setLastTriggeredAt(now);
            return rule;
        });
    }

    private Notification recordSent(Notification notification) {
        Notification sent = notification.toBuilder()
                .status(NotificationStatus.SENT)
                .sentAt(clock.instant())
                .build();
        metrics.recordNotificationSent(sent.getChannel());
        structuredLogger.logNotificationEvent(sent.getId(), NotificationEventType.SENT,
                "Sent " + sent.getType() + " notification via " + sent.getChannel(),
                Map.of("channel", sent.getChannel(), "type", String.valueOf(sent.getType())));
        return record(sent);
    }

    private Notification recordFailed(Notification notification, String error) {
        Notification failed = notification.toBuilder()
                .status(NotificationStatus.FAILED)
                .error(error)
                .failedAt(clock.instant())
                .build();
        metrics.recordNotificationFailed(failed.getChannel());
        structuredLogger.logNotificationEvent(failed.getId(), NotificationEventType.FAILED,
                "Failed to send " + failed.getType() + " notification via " + failed.getChannel(),
                Map.of("channel", String.valueOf(failed.getChannel()), "error", String.valueOf(error)));
        return record(failed);
    }

    private Notification record(Notification notification) {
        historyStore.appendNotification(notification);
        eventProducer.publishNotification(notification);
        return notification;
    }

    private static long count(List<Notification> notifications, NotificationStatus status) {
        return notifications.stream().filter(n -> n.getStatus() == status).count();
    }

    private static Map<String, Map<String, Long>> breakdown(List<Notification> notifications,
                                                            Function<Notification, String> key) {
        Map<String, Map<String, Long>> result = new TreeMap<>();
        for (Notification notification : notifications) {
            Map<String, Long> counts = result.computeIfAbsent(String.valueOf(key.apply(notification)), k -> {
                Map<String, Long> initial = new HashMap<>();
                initial.put("sent", 0L);
                initial.put("failed", 0L);
                return initial;
            });
            if (notification.getStatus() == NotificationStatus.SENT) {
                counts.merge("sent", 1L, Long::sum);
            } else if (notification.getStatus() == NotificationStatus.FAILED) {
                counts.merge("failed", 1L, Long::sum);
            }
        }
        return result;
    }
}
