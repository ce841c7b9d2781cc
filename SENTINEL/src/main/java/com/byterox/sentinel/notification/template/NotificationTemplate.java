package com.byterox.sentinel.notification.template;

import java.util.Map;

/**
 * Subject and body templates registered under {@code channel_type}.
 */
public final class NotificationTemplate {

    private final String key;
    private final CompiledTemplate subject;
    private final CompiledTemplate body;

    NotificationTemplate(String key, CompiledTemplate subject, CompiledTemplate body) {
        this.key = key;
        this.subject = subject;
        this.body = body;
    }

    public RenderedMessage render(Map<String, ?> data) {
        return new RenderedMessage(subject != null ? subject.render(data) : null, body.render(data));
    }

    public String key() {
        return key;
    }
}
