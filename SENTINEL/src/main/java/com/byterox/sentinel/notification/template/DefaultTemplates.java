package com.byterox.sentinel.notification.template;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in templates keyed by {@code channel_type}. Each value is {subject, body}.
 */
final class DefaultTemplates {

    private DefaultTemplates() {
    }

    static Map<String, String[]> all() {
        Map<String, String[]> templates = new LinkedHashMap<>();

        // Email
        templates.put("email_scan_complete", new String[]{
                "Scan Complete - {{target}}",
                """
                <h2>Scan Complete</h2>
                <p><strong>Target:</strong> {{target}}</p>
                <p><strong>Job:</strong> {{job_name}}</p>
                <p><strong>Completed:</strong> {{completed_at}}</p>
                <h3>Summary</h3>
                <ul>
                  <li><strong>Security Score:</strong> {{security_score}}%</li>
                  <li><strong>Risk Level:</strong> {{risk_level}}</li>
                  <li><strong>Total Findings:</strong> {{total_findings}}</li>
                </ul>
                <h3>Vulnerabilities</h3>
                <ul>
                  <li><strong>Critical:</strong> {{critical_issues}}</li>
                  <li><strong>High:</strong> {{high_issues}}</li>
                  <li><strong>Medium:</strong> {{medium_issues}}</li>
                  <li><strong>Low:</strong> {{low_issues}}</li>
                </ul>
                <p><a href='{{dashboard_url}}'>View Full Report</a></p>
                """});
        templates.put("email_scan_failed", new String[]{
                "Scan Failed - {{target}}",
                """
                <h2>Scan Failed</h2>
                <p><strong>Target:</strong> {{target}}</p>
                <p><strong>Job:</strong> {{job_name}}</p>
                <p><strong>Error:</strong> {{error}}</p>
                """});
        templates.put("email_vulnerability_alert", new String[]{
                "Vulnerability Alert - {{target}}",
                """
                <h2>Vulnerability Alert</h2>
                <p><strong>Target:</strong> {{target}}</p>
                <p><strong>Severity:</strong> <span style='color: red;'>{{severity}}</span></p>
                <p><strong>Detected:</strong> {{detected_at}}</p>
                <h3>Details</h3>
                <p>{{message}}</p>
                <p><strong>Security Score:</strong> {{security_score}}% ({{risk_level}})</p>
                <p><strong>Critical / High:</strong> {{critical_issues}} / {{high_issues}}</p>
                <p><a href='{{dashboard_url}}'>View Details</a></p>
                """});
        templates.put("email_threat_detected", new String[]{
                "Threat Intelligence Alert - {{target}}",
                """
                <h2>Threat Intelligence Alert</h2>
                <p><strong>Target:</strong> {{target}}</p>
                <p><strong>Threat Type:</strong> {{threat_type}}</p>
                <p><strong>Confidence:</strong> {{confidence}}</p>
                <p><strong>Detected:</strong> {{detected_at}}</p>
                <h3>Threat Details</h3>
                <p>{{threat_description}}</p>
                <h3>Recommended Actions</h3>
                <p>{{recommendations}}</p>
                <p><a href='{{dashboard_url}}'>View Full Analysis</a></p>
                """});
        templates.put("email_test", new String[]{
                "Test Notification",
                "<p>This is a test notification from {{source}} sent at {{timestamp}}.</p>"});

        // Slack
        templates.put("slack_scan_complete", new String[]{null,
                "*Scan Complete* for {{target}}\n"
                        + "*Security Score:* {{security_score}}% | *Risk Level:* {{risk_level}}\n"
                        + "*Vulnerabilities:* {{critical_issues}} Critical, {{high_issues}} High, "
                        + "{{medium_issues}} Medium\n<{{dashboard_url}}|View Report>"});
        templates.put("slack_scan_failed", new String[]{null,
                "*Scan Failed* for {{target}} in job {{job_name}}: {{error}}"});
        templates.put("slack_vulnerability_alert", new String[]{null,
                "*Vulnerability Alert* for {{target}}\n*Severity:* {{severity}}\n{{message}}\n"
                        + "<{{dashboard_url}}|View Details>"});
        templates.put("slack_threat_detected", new String[]{null,
                "*Threat Intelligence Alert* for {{target}}\n*Type:* {{threat_type}} | "
                        + "*Confidence:* {{confidence}}\n{{threat_description}}"});
        templates.put("slack_test", new String[]{null,
                "Test notification from {{source}} at {{timestamp}}"});

        // SMS
        templates.put("sms_scan_complete", new String[]{null,
                "Scan complete for {{target}}. Score: {{security_score}}%, Risk: {{risk_level}}"});
        templates.put("sms_scan_failed", new String[]{null,
                "Scan failed for {{target}}: {{error}}"});
        templates.put("sms_vulnerability_alert", new String[]{null,
                "ALERT: {{severity}} vulnerability on {{target}}. Check dashboard immediately."});
        templates.put("sms_threat_detected", new String[]{null,
                "THREAT: {{threat_type}} detected on {{target}}. Confidence: {{confidence}}"});
        templates.put("sms_test", new String[]{null,
                "Test notification from {{source}}"});

        // Webhook
        templates.put("webhook_scan_complete", new String[]{"scan_complete",
                "Scan complete for {{target}}: score {{security_score}}, risk {{risk_level}}"});
        templates.put("webhook_scan_failed", new String[]{"scan_failed",
                "Scan failed for {{target}}: {{error}}"});
        templates.put("webhook_vulnerability_alert", new String[]{"vulnerability_alert",
                "{{message}}"});
        templates.put("webhook_threat_detected", new String[]{"threat_detected",
                "{{threat_type}} detected on {{target}} ({{confidence}})"});
        templates.put("webhook_test", new String[]{"test",
                "Test notification from {{source}}"});

        return templates;
    }
}
