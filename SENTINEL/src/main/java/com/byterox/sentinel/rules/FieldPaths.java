package com.byterox.sentinel.rules;

import java.util.Map;

/**
 * Dotted-path lookup over nested maps, e.g. {@code summary.securityScore}.
 */
public final class FieldPaths {

    private FieldPaths() {
    }

    /**
     * @return the value at the path, or null when any segment is missing
     */
    public static Object resolve(Map<String, ?> document, String path) {
        if (document == null || path == null || path.isBlank()) {
            return null;
        }
        if (document.containsKey(path)) {
            return document.get(path);
        }
        Object current = document;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }
}
