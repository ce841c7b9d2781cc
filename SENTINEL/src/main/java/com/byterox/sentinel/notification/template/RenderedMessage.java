package com.byterox.sentinel.notification.template;

/**
 * Output of rendering a notification template. The subject is null for channels without one.
 */
public record RenderedMessage(String subject, String body) {
}
