package com.byterox.sentinel.rules.action;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.domain.model.ActionOutcome;
import com.byterox.sentinel.domain.model.ChannelTarget;
import com.byterox.sentinel.domain.model.Notification;
import com.byterox.sentinel.domain.model.NotificationStatus;
import com.byterox.sentinel.domain.model.ScanResult;
import com.byterox.sentinel.exception.TemplateException;
import com.byterox.sentinel.notification.NotificationDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Sends an alert notification on each configured channel.
 * <p>
 * Config: {@code channels} (names or {channel, options} maps), {@code template}
 * (default vulnerability_alert) and {@code severity} (default high).
 */
@Slf4j
@Component
public class SendAlertHandler implements ActionHandler {

    static final String DEFAULT_TEMPLATE = "vulnerability_alert";

    private final NotificationDispatcher dispatcher;
    private final SentinelProperties properties;
    private final Clock clock;

    public SendAlertHandler(NotificationDispatcher dispatcher, SentinelProperties properties, Clock clock) {
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public ActionType type() {
        return ActionType.SEND_ALERT;
    }

    @Override
    public Mono<ActionOutcome> handle(ActionContext context) {
        String template = ActionConfigs.string(context.getConfig(), "template", DEFAULT_TEMPLATE);
        List<ChannelTarget> channels = channels(context.getConfig().get("channels"));
        if (channels.isEmpty()) {
            properties.getNotification().getDefaultAlertChannels()
                    .forEach(channel -> channels.add(new ChannelTarget(channel, Map.of())));
        }
        Map<String, Object> data = alertData(context);

        return Flux.fromIterable(channels)
                .concatMap(channel -> dispatcher.send(template, channel.getChannel(), data, channel.getOptions())
                        .onErrorResume(TemplateException.class, error -> Mono.just(Notification.builder()
                                .channel(channel.getChannel())
                                .type(template)
                                .status(NotificationStatus.FAILED)
                                .error(error.getMessage())
                                .build())))
                .collectList()
                .map(notifications -> {
                    boolean allSent = notifications.stream()
                            .allMatch(n -> n.getStatus() == NotificationStatus.SENT);
                    Map<String, Object> details = new HashMap<>();
                    details.put("template", template);
                    details.put("notifications", notifications.stream().map(n -> {
                        Map<String, Object> entry = new HashMap<>();
                        entry.put("id", n.getId());
                        entry.put("channel", n.getChannel());
                        entry.put("status", n.getStatus().name().toLowerCase(Locale.ROOT));
                        entry.put("error", n.getError());
                        return entry;
                    }).toList());
                    return ActionOutcome.builder()
                            .actionType(type().value())
                            .success(allSent)
                            .message(allSent
                                    ? "Alert sent on " + notifications.size() + " channel(s)"
                                    : "Alert delivery failed on one or more channels")
                            .details(details)
                            .executedAt(clock.instant())
                            .build();
                });
    }

    static String alertMessage(String ruleName, String target, Object score) {
        return "Automation rule '" + ruleName + "' triggered for " + target + ". Security score: "
                + (score != null ? score : "") + "%";
    }

    private Map<String, Object> alertData(ActionContext context) {
        Map<String, Object> data = new HashMap<>(context.getData());
        ScanResult result = context.getScanResult();
        Object score = data.get("security_score");
        if (result != null && result.getSummary() != null) {
            ScanResult.Summary summary = result.getSummary();
            score = summary.getSecurityScore();
            data.put("security_score", summary.getSecurityScore());
            data.put("risk_level", summary.getRiskLevel());
            data.put("total_findings", summary.getTotalFindings());
            data.put("critical_issues", summary.getCriticalFindings());
            data.put("high_issues", summary.getHighFindings());
            data.put("medium_issues", summary.getMediumFindings());
            data.put("low_issues", summary.getLowFindings());
        }
        data.put("target", context.getTarget());
        data.put("rule_id", context.getRuleId());
        data.put("rule_name", context.source());
        data.put("severity", ActionConfigs.string(context.getConfig(), "severity", "high"));
        data.put("message", alertMessage(context.source(), context.getTarget(), score));
        return data;
    }

    @SuppressWarnings("unchecked")
    private static List<ChannelTarget> channels(Object value) {
        List<ChannelTarget> channels = new ArrayList<>();
        if (value instanceof Collection<?> entries) {
            for (Object entry : entries) {
                if (entry instanceof Map<?, ?> map && map.get("channel") != null) {
                    Object options = map.get("options");
                    channels.add(new ChannelTarget(map.get("channel").toString(),
                            options instanceof Map<?, ?> ? (Map<String, Object>) options : Map.of()));
                } else if (entry != null) {
                    channels.add(new ChannelTarget(entry.toString(), Map.of()));
                }
            }
        } else if (value instanceof String text && !text.isBlank()) {
            channels.add(new ChannelTarget(text.trim(), Map.of()));
        }
        return channels;
    }
}
