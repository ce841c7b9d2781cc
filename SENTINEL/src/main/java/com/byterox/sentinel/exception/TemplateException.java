package com.byterox.sentinel.exception;

/**
 * No template is registered for a channel/type pair.
 */
public class TemplateException extends SentinelException {

    private final String templateKey;

    public TemplateException(String templateKey) {
        super("Template not found: " + templateKey);
        this.templateKey = templateKey;
    }

    public String getTemplateKey() {
        return templateKey;
    }
}
