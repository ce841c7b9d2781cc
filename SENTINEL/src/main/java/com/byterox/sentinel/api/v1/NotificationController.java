package com.byterox.sentinel.api.v1;

import com.byterox.sentinel.api.dto.NotificationSendRequest;
import com.byterox.sentinel.api.dto.NotificationTestRequest;
import com.byterox.sentinel.domain.model.Notification;
import com.byterox.sentinel.domain.model.NotificationRule;
import com.byterox.sentinel.domain.model.NotificationStats;
import com.byterox.sentinel.domain.model.NotificationStatus;
import com.byterox.sentinel.exception.ValidationException;
import com.byterox.sentinel.notification.NotificationDispatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST API controller for notification delivery, history and rules.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/notifications")
@Tag(name = "Notifications", description = "Notification delivery, history and rules")
public class NotificationController {

    private final NotificationDispatcher dispatcher;

    public NotificationController(NotificationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping("/test")
    @Operation(summary = "Test channel", description = "Send a test notification to verify a channel configuration")
    public Mono<ResponseEntity<Notification>> testChannel(@Valid @RequestBody NotificationTestRequest request) {
        return dispatcher.sendTest(request.getChannel(), request.getOptions())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/send")
    @Operation(summary = "Send notification")
    public Mono<ResponseEntity<Notification>> send(@Valid @RequestBody NotificationSendRequest request) {
        return dispatcher.send(request.getType(), request.getChannel(), request.getData(), request.getOptions())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/trigger/{type}")
    @Operation(summary = "Process trigger", description = "Fan a trigger out to the matching notification rules")
    public Mono<ResponseEntity<List<Notification>>> trigger(
            @Parameter(description = "Trigger type, e.g. scan_complete") @PathVariable String type,
            @RequestBody(required = false) Map<String, Object> data) {
        return dispatcher.processTrigger(type, data != null ? data : Map.of())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/history")
    @Operation(summary = "Notification history", description = "Newest first, optionally filtered")
    public Mono<ResponseEntity<List<Notification>>> history(
            @Parameter(description = "Filter by channel") @RequestParam(required = false) String channel,
            @Parameter(description = "Filter by type") @RequestParam(required = false) String type,
            @Parameter(description = "Filter by status") @RequestParam(required = false) String status,
            @Parameter(description = "Maximum entries") @RequestParam(defaultValue = "50") int limit) {
        return Mono.fromCallable(() -> ResponseEntity.ok(
                dispatcher.getHistory(channel, type, parseStatus(status), limit)));
    }

    @GetMapping("/stats")
    @Operation(summary = "Notification statistics")
    public Mono<ResponseEntity<NotificationStats>> stats() {
        return Mono.fromCallable(dispatcher::getStats)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/rules")
    @Operation(summary = "List notification rules")
    public Mono<ResponseEntity<List<NotificationRule>>> listRules() {
        return Mono.fromCallable(dispatcher::listRules)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/rules")
    @Operation(summary = "Create notification rule")
    public Mono<ResponseEntity<NotificationRule>> createRule(@RequestBody NotificationRule rule) {
        return Mono.fromCallable(() -> dispatcher.createRule(rule))
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @DeleteMapping("/rules/{id}")
    @Operation(summary = "Delete notification rule")
    public Mono<ResponseEntity<Void>> deleteRule(
            @Parameter(description = "Rule ID") @PathVariable String id) {
        return Mono.fromRunnable(() -> dispatcher.deleteRule(id))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    private static NotificationStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return NotificationStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown status '" + status + "', expected one of "
                    + Arrays.toString(NotificationStatus.values()));
        }
    }
}
