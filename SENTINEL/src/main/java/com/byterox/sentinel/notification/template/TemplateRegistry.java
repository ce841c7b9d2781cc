package com.byterox.sentinel.notification.template;

import com.byterox.sentinel.config.SentinelProperties;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Notification templates keyed by {@code channel_type}.
 * <p>
 * Built-in templates are overlaid by {@code sentinel.notification.templates} and by
 * runtime registrations. Parsed forms are cached by source text.
 */
@Slf4j
@Component
public class TemplateRegistry {

    private final Map<String, String[]> sources = new ConcurrentHashMap<>();
    private final LoadingCache<String, CompiledTemplate> compiled;

    public TemplateRegistry(SentinelProperties properties) {
        this.compiled = Caffeine.newBuilder()
                .maximumSize(properties.getNotification().getTemplateCacheSize())
                .build(CompiledTemplate::parse);

        sources.putAll(DefaultTemplates.all());
        properties.getNotification().getTemplates().forEach((key, template) ->
                register(key, template.getSubject(), template.getBody()));
        log.info("Loaded {} notification templates", sources.size());
    }

    public static String keyOf(String channel, String type) {
        return channel + "_" + type;
    }

    public Optional<NotificationTemplate> find(String channel, String type) {
        String key = keyOf(channel, type);
        String[] source = sources.get(key);
        if (source == null) {
            return Optional.empty();
        }
        CompiledTemplate subject = source[0] != null ? compiled.get(source[0]) : null;
        return Optional.of(new NotificationTemplate(key, subject, compiled.get(source[1])));
    }

    /**
     * Add or replace a template. A null body is rejected.
     */
    public void register(String key, String subject, String body) {
        if (key == null || body == null) {
            throw new IllegalArgumentException("Template key and body are required");
        }
        sources.put(key, new String[]{subject, body});
        log.debug("Registered notification template {}", key);
    }
}
