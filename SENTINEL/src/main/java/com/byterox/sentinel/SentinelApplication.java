package com.byterox.sentinel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * SENTINEL - Automation and Rule Engine for the ByteRox scanning platform.
 * <p>
 * SENTINEL is responsible for:
 * <ul>
 *     <li>Running cron-scheduled scans across target lists</li>
 *     <li>Evaluating automation rules against scan results and dispatching actions</li>
 *     <li>Executing multi-step workflows with an accumulating context</li>
 *     <li>Rendering and delivering notifications over email, Slack, webhook and SMS</li>
 * </ul>
 * <p>
 * Scans are delegated to the external scan provider; SENTINEL only consumes its
 * normalized result documents.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class SentinelApplication {

    public static void main(String[] args) {
        SpringApplication.run(SentinelApplication.class, args);
    }
}
