package com.byterox.sentinel.domain.service;

import com.byterox.sentinel.domain.model.DetectionRule;
import com.byterox.sentinel.domain.model.ExclusionList;
import com.byterox.sentinel.domain.model.RuleAction;
import com.byterox.sentinel.domain.model.RuleCondition;
import com.byterox.sentinel.domain.model.ScanProfile;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in scan profiles, detection rules and exclusion lists.
 */
final class ConfigurationDefaults {

    private ConfigurationDefaults() {
    }

    static List<ScanProfile> scanProfiles(Instant now) {
        return List.of(
                profile("quick", "Quick Scan", "Fast subdomain enumeration with basic checks", true, now, Map.of(
                        "enumeration", Map.of("techniques", List.of("passive"), "wordlistSize", "small"),
                        "dns_analysis", Map.of("enabled", true, "security_checks", List.of("basic")),
                        "http_analysis", Map.of("enabled", true, "security_headers", true, "ssl_analysis", false),
                        "port_scanning", Map.of("enabled", false),
                        "rate_limit", Map.of("requests_per_second", 100),
                        "timeout_seconds", 30)),
                profile("comprehensive", "Comprehensive Scan", "Complete security assessment with all features",
                        false, now, Map.of(
                        "enumeration", Map.of("techniques", List.of("passive", "active"), "wordlistSize", "medium",
                                "bruteforce", true),
                        "dns_analysis", Map.of("enabled", true, "security_checks", List.of("full"),
                                "health_checks", true),
                        "http_analysis", Map.of("enabled", true, "security_headers", true, "ssl_analysis", true),
                        "port_scanning", Map.of("enabled", true, "scan_type", "comprehensive",
                                "service_detection", true),
                        "rate_limit", Map.of("requests_per_second", 50),
                        "timeout_seconds", 120)),
                profile("stealth", "Stealth Scan", "Low-profile scanning to avoid detection", false, now, Map.of(
                        "enumeration", Map.of("techniques", List.of("passive"), "wordlistSize", "small"),
                        "dns_analysis", Map.of("enabled", true, "security_checks", List.of("basic")),
                        "http_analysis", Map.of("enabled", true, "security_headers", true,
                                "user_agent_rotation", true),
                        "port_scanning", Map.of("enabled", false),
                        "rate_limit", Map.of("requests_per_second", 5, "random_delay", true),
                        "timeout_seconds", 60)),
                profile("deep", "Deep Security Scan", "Intensive security analysis with all tools", false, now, Map.of(
                        "enumeration", Map.of("techniques", List.of("passive", "active", "permutation"),
                                "wordlistSize", "large"),
                        "dns_analysis", Map.of("enabled", true, "security_checks", List.of("full", "advanced"),
                                "zone_transfer_attempts", true),
                        "http_analysis", Map.of("enabled", true, "ssl_analysis", true,
                                "vulnerability_scanning", true),
                        "port_scanning", Map.of("enabled", true, "scan_type", "full", "include_udp", true),
                        "rate_limit", Map.of("requests_per_second", 25),
                        "timeout_seconds", 300))
        );
    }

    static List<DetectionRule> detectionRules(Instant now) {
        return List.of(
                detection("critical_findings_present", "Critical Findings Present",
                        "A scan reported at least one critical finding", "vulnerability", "critical", now,
                        List.of(condition("summary.criticalFindings", "greater_than", 0)),
                        List.of(action("send_alert", Map.of("channels", List.of("email", "slack"))),
                                action("trigger_incident", Map.of("severity", "critical")))),
                detection("low_security_score", "Low Security Score",
                        "Security score dropped below 50", "posture", "high", now,
                        List.of(condition("summary.securityScore", "less_than", 50)),
                        List.of(action("send_alert", Map.of("channels", List.of("email"))))),
                detection("high_risk_level", "High Risk Level",
                        "Target classified as high or critical risk", "posture", "high", now,
                        List.of(condition("summary.riskLevel", "in", List.of("High", "Critical"))),
                        List.of(action("send_alert", Map.of("channels", List.of("slack")))))
        );
    }

    static List<ExclusionList> exclusionLists(Instant now) {
        return List.of(
                exclusion("global", "Global Exclusions", "Globally excluded domains and IPs", "global", true, now,
                        List.of("localhost", "*.internal", "*.lan", "*.local"),
                        List.of("127.0.0.1", "0.0.0.0", "10.0.0.0/8", "172.16.0.0/12", "192.168.0.0/16"),
                        List.of("*.test", "*.example", "*.invalid")),
                exclusion("cdn_cloud", "CDN and Cloud Provider Exclusions", "Exclude common CDN and cloud services",
                        "service", false, now,
                        List.of("*.amazonaws.com", "*.cloudfront.net", "*.cloudflare.com", "*.azure.com",
                                "*.googleapis.com", "*.fastly.com"),
                        List.of(),
                        List.of("*-cdn-*", "*-edge-*")),
                exclusion("dev_test", "Development and Testing Exclusions",
                        "Exclude development and testing environments", "environment", false, now,
                        List.of(),
                        List.of(),
                        List.of("dev.*", "test.*", "staging.*", "beta.*", "preview.*"))
        );
    }

    // ========== Private Methods ==========

    private static ScanProfile profile(String id, String name, String description, boolean isDefault,
                                       Instant now, Map<String, Object> config) {
        return ScanProfile.builder()
                .id(id)
                .name(name)
                .description(description)
                .defaultProfile(isDefault)
                .config(new HashMap<>(config))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static DetectionRule detection(String id, String name, String description, String category,
                                           String severity, Instant now, List<RuleCondition> conditions,
                                           List<RuleAction> actions) {
        return DetectionRule.builder()
                .id(id)
                .name(name)
                .description(description)
                .category(category)
                .severity(severity)
                .conditions(new ArrayList<>(conditions))
                .actions(new ArrayList<>(actions))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static ExclusionList exclusion(String id, String name, String description, String type,
                                           boolean enabled, Instant now, List<String> domains,
                                           List<String> ips, List<String> patterns) {
        return ExclusionList.builder()
                .id(id)
                .name(name)
                .description(description)
                .type(type)
                .enabled(enabled)
                .domains(new ArrayList<>(domains))
                .ips(new ArrayList<>(ips))
                .patterns(new ArrayList<>(patterns))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static RuleCondition condition(String field, String operator, Object threshold) {
        return RuleCondition.builder().field(field).operator(operator).threshold(threshold).build();
    }

    private static RuleAction action(String type, Map<String, Object> config) {
        return RuleAction.builder().type(type).config(new HashMap<>(config)).build();
    }
}
