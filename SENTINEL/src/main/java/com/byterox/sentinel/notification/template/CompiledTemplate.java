package com.byterox.sentinel.notification.template;

import com.byterox.sentinel.rules.FieldPaths;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A template parsed into literal segments and {@code {{field}}} placeholders.
 * <p>
 * Rendering is a single pass over the segments, so a substituted value is never
 * re-scanned for placeholders. Missing fields render as the empty string.
 */
public final class CompiledTemplate {

    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";

    private final String source;
    private final List<Segment> segments;

    private CompiledTemplate(String source, List<Segment> segments) {
        this.source = source;
        this.segments = List.copyOf(segments);
    }

    public static CompiledTemplate parse(String source) {
        List<Segment> segments = new ArrayList<>();
        String text = source != null ? source : "";
        int position = 0;
        while (position < text.length()) {
            int open = text.indexOf(OPEN, position);
            if (open < 0) {
                segments.add(new Literal(text.substring(position)));
                break;
            }
            int close = text.indexOf(CLOSE, open + OPEN.length());
            if (close < 0) {
                segments.add(new Literal(text.substring(position)));
                break;
            }
            if (open > position) {
                segments.add(new Literal(text.substring(position, open)));
            }
            String field = text.substring(open + OPEN.length(), close).trim();
            if (field.isEmpty()) {
                segments.add(new Literal(text.substring(open, close + CLOSE.length())));
            } else {
                segments.add(new Placeholder(field));
            }
            position = close + CLOSE.length();
        }
        return new CompiledTemplate(text, segments);
    }

    public String render(Map<String, ?> data) {
        StringBuilder out = new StringBuilder();
        for (Segment segment : segments) {
            segment.appendTo(out, data);
        }
        return out.toString();
    }

    /**
     * @return the placeholder field names, in order of appearance
     */
    public List<String> fields() {
        return segments.stream()
                .filter(Placeholder.class::isInstance)
                .map(segment -> ((Placeholder) segment).field)
                .toList();
    }

    public String source() {
        return source;
    }

    // ========== Segments ==========

    private interface Segment {
        void appendTo(StringBuilder out, Map<String, ?> data);
    }

    private record Literal(String text) implements Segment {
        @Override
        public void appendTo(StringBuilder out, Map<String, ?> data) {
            out.append(text);
        }
    }

    private record Placeholder(String field) implements Segment {
        @Override
        public void appendTo(StringBuilder out, Map<String, ?> data) {
            out.append(format(FieldPaths.resolve(data, field)));
        }
    }

    static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(CompiledTemplate::format).collect(Collectors.joining(", "));
        }
        return value.toString();
    }
}
