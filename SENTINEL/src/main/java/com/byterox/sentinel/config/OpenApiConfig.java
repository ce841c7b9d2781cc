package com.byterox.sentinel.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for SENTINEL service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8088}")
    private int serverPort;

    @Bean
    public OpenAPI sentinelOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SENTINEL Automation API")
                        .description("""
                                SENTINEL runs the automation side of the ByteRox scanning platform.
                                
                                ## Features
                                
                                - **Schedules**: cron-driven scans over target lists
                                - **Rules**: condition/action automation against scan results
                                - **Workflows**: ordered scan, notify, wait, condition and action steps
                                - **Notifications**: templated email, Slack, webhook and SMS delivery
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("ByteRox Platform Team")
                                .email("platform@byterox.io")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ))
                .tags(List.of(
                        new Tag().name("Schedules").description("Scheduled scan jobs"),
                        new Tag().name("Workflows").description("Workflow definitions and executions"),
                        new Tag().name("Notifications").description("Notification delivery, rules and history"),
                        new Tag().name("Configuration").description("Scan profiles, rules and exclusion lists")
                ));
    }
}
