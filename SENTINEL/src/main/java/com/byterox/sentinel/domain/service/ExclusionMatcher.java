package com.byterox.sentinel.domain.service;

import com.byterox.sentinel.domain.model.ExclusionList;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Matches scan targets against exclusion lists.
 * <p>
 * Domains and patterns support {@code *} and {@code ?} wildcards, case-insensitively.
 * IP entries are exact IPv4 addresses or CIDR blocks.
 */
final class ExclusionMatcher {

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");

    private ExclusionMatcher() {
    }

    static boolean matches(ExclusionList list, String target) {
        String host = hostOf(target);
        if (host.isEmpty()) {
            return false;
        }
        Integer port = portOf(target);
        if (port != null && list.getPorts() != null && list.getPorts().contains(port)) {
            return true;
        }
        if (isIpv4(host)) {
            return matchesIp(list.getIps(), host);
        }
        return matchesHost(list.getDomains(), host) || matchesHost(list.getPatterns(), host);
    }

    static boolean matchesPattern(String text, String pattern) {
        StringBuilder regex = new StringBuilder("^");
        for (char c : pattern.toLowerCase(Locale.ROOT).toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        regex.append('$');
        return Pattern.matches(regex.toString(), text.toLowerCase(Locale.ROOT));
    }

    static boolean isIpInCidr(String ip, String cidr) {
        String[] parts = cidr.split("/");
        if (parts.length != 2 || !isIpv4(parts[0]) || !isIpv4(ip)) {
            return false;
        }
        int prefix;
        try {
            prefix = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            return false;
        }
        if (prefix < 0 || prefix > 32) {
            return false;
        }
        long mask = prefix == 0 ? 0 : (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
        return (toLong(ip) & mask) == (toLong(parts[0].trim()) & mask);
    }

    static boolean isValidIpEntry(String entry) {
        if (entry == null) {
            return false;
        }
        String[] parts = entry.split("/");
        if (parts.length == 1) {
            return isIpv4(parts[0]);
        }
        if (parts.length != 2 || !isIpv4(parts[0])) {
            return false;
        }
        try {
            int prefix = Integer.parseInt(parts[1]);
            return prefix >= 0 && prefix <= 32;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    // ========== Private Methods ==========

    private static boolean matchesIp(List<String> entries, String ip) {
        if (entries == null) {
            return false;
        }
        for (String entry : entries) {
            if (entry.contains("/") ? isIpInCidr(ip, entry) : entry.trim().equals(ip)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesHost(List<String> entries, String host) {
        if (entries == null) {
            return false;
        }
        return entries.stream().anyMatch(entry -> matchesPattern(host, entry.trim()));
    }

    private static String hostOf(String target) {
        if (target == null) {
            return "";
        }
        String trimmed = target.trim().toLowerCase(Locale.ROOT);
        if (trimmed.contains("://")) {
            URI uri = parseUri(trimmed);
            return uri != null && uri.getHost() != null ? uri.getHost() : "";
        }
        int slash = trimmed.indexOf('/');
        String authority = slash >= 0 ? trimmed.substring(0, slash) : trimmed;
        int colon = authority.lastIndexOf(':');
        return colon >= 0 ? authority.substring(0, colon) : authority;
    }

    private static Integer portOf(String target) {
        if (target == null) {
            return null;
        }
        String trimmed = target.trim();
        if (trimmed.contains("://")) {
            URI uri = parseUri(trimmed);
            return uri != null && uri.getPort() >= 0 ? uri.getPort() : null;
        }
        int slash = trimmed.indexOf('/');
        String authority = slash >= 0 ? trimmed.substring(0, slash) : trimmed;
        int colon = authority.lastIndexOf(':');
        if (colon < 0) {
            return null;
        }
        try {
            return Integer.parseInt(authority.substring(colon + 1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static URI parseUri(String value) {
        try {
            return URI.create(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static boolean isIpv4(String value) {
        var matcher = IPV4.matcher(value.trim());
        if (!matcher.matches()) {
            return false;
        }
        for (int i = 1; i <= 4; i++) {
            if (Integer.parseInt(matcher.group(i)) > 255) {
                return false;
            }
        }
        return true;
    }

    private static long toLong(String ip) {
        long value = 0;
        for (String octet : ip.trim().split("\\.")) {
            value = (value << 8) | Integer.parseInt(octet);
        }
        return value;
    }
}
