package com.byterox.sentinel.api.v1;

import com.byterox.sentinel.api.dto.ExclusionCheckResponse;
import com.byterox.sentinel.domain.model.AutomationRule;
import com.byterox.sentinel.domain.model.ConfigurationExport;
import com.byterox.sentinel.domain.model.ConfigurationStats;
import com.byterox.sentinel.domain.model.DetectionRule;
import com.byterox.sentinel.domain.model.ExclusionList;
import com.byterox.sentinel.domain.model.ImportResult;
import com.byterox.sentinel.domain.model.ScanProfile;
import com.byterox.sentinel.domain.service.ConfigurationStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST API controller for scan profiles, rules and exclusion lists.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Configuration", description = "Scan profiles, automation and detection rules, exclusion lists")
public class ConfigurationController {

    private final ConfigurationStore store;

    public ConfigurationController(ConfigurationStore store) {
        this.store = store;
    }

    // ========== Scan Profiles ==========

    @GetMapping("/profiles")
    @Operation(summary = "List scan profiles")
    public Mono<ResponseEntity<List<ScanProfile>>> listProfiles() {
        return Mono.fromCallable(store::listProfiles).map(ResponseEntity::ok);
    }

    @GetMapping("/profiles/{id}")
    @Operation(summary = "Get scan profile")
    public Mono<ResponseEntity<ScanProfile>> getProfile(
            @Parameter(description = "Profile ID") @PathVariable String id) {
        return Mono.fromCallable(() -> store.getProfile(id)).map(ResponseEntity::ok);
    }

    @PostMapping("/profiles")
    @Operation(summary = "Create scan profile")
    public Mono<ResponseEntity<ScanProfile>> createProfile(@RequestBody ScanProfile profile) {
        return Mono.fromCallable(() -> store.createProfile(profile))
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @PutMapping("/profiles/{id}")
    @Operation(summary = "Update scan profile")
    public Mono<ResponseEntity<ScanProfile>> updateProfile(
            @Parameter(description = "Profile ID") @PathVariable String id,
            @RequestBody ScanProfile changes) {
        return Mono.fromCallable(() -> store.updateProfile(id, changes)).map(ResponseEntity::ok);
    }

    @DeleteMapping("/profiles/{id}")
    @Operation(summary = "Delete scan profile")
    public Mono<ResponseEntity<Void>> deleteProfile(
            @Parameter(description = "Profile ID") @PathVariable String id) {
        return Mono.fromRunnable(() -> store.deleteProfile(id))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    // ========== Automation Rules ==========

    @GetMapping("/automation-rules")
    @Operation(summary = "List automation rules")
    public Mono<ResponseEntity<List<AutomationRule>>> listAutomationRules() {
        return Mono.fromCallable(store::listAutomationRules).map(ResponseEntity::ok);
    }

    @GetMapping("/automation-rules/{id}")
    @Operation(summary = "Get automation rule")
    public Mono<ResponseEntity<AutomationRule>> getAutomationRule(
            @Parameter(description = "Rule ID") @PathVariable String id) {
        return Mono.fromCallable(() -> store.getAutomationRule(id)).map(ResponseEntity::ok);
    }

    @PostMapping("/automation-rules")
    @Operation(summary = "Create automation rule", description = "Conditions and actions are validated first")
    public Mono<ResponseEntity<AutomationRule>> createAutomationRule(@RequestBody AutomationRule rule) {
        return Mono.fromCallable(() -> store.createAutomationRule(rule))
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @PutMapping("/automation-rules/{id}")
    @Operation(summary = "Update automation rule")
    public Mono<ResponseEntity<AutomationRule>> updateAutomationRule(
            @Parameter(description = "Rule ID") @PathVariable String id,
            @RequestBody AutomationRule changes) {
        return Mono.fromCallable(() -> store.updateAutomationRule(id, changes)).map(ResponseEntity::ok);
    }

    @DeleteMapping("/automation-rules/{id}")
    @Operation(summary = "Delete automation rule")
    public Mono<ResponseEntity<Void>> deleteAutomationRule(
            @Parameter(description = "Rule ID") @PathVariable String id) {
        return Mono.fromRunnable(() -> store.deleteAutomationRule(id))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    // ========== Detection Rules ==========

    @GetMapping("/detection-rules")
    @Operation(summary = "List detection rules")
    public Mono<ResponseEntity<List<DetectionRule>>> listDetectionRules() {
        return Mono.fromCallable(store::listDetectionRules).map(ResponseEntity::ok);
    }

    @GetMapping("/detection-rules/{id}")
    @Operation(summary = "Get detection rule")
    public Mono<ResponseEntity<DetectionRule>> getDetectionRule(
            @Parameter(description = "Rule ID") @PathVariable String id) {
        return Mono.fromCallable(() -> store.getDetectionRule(id)).map(ResponseEntity::ok);
    }

    @PostMapping("/detection-rules")
    @Operation(summary = "Create detection rule")
    public Mono<ResponseEntity<DetectionRule>> createDetectionRule(@RequestBody DetectionRule rule) {
        return Mono.fromCallable(() -> store.createDetectionRule(rule))
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @PutMapping("/detection-rules/{id}")
    @Operation(summary = "Update detection rule")
    public Mono<ResponseEntity<DetectionRule>> updateDetectionRule(
            @Parameter(description = "Rule ID") @PathVariable String id,
            @RequestBody DetectionRule changes) {
        return Mono.fromCallable(() -> store.updateDetectionRule(id, changes)).map(ResponseEntity::ok);
    }

    @DeleteMapping("/detection-rules/{id}")
    @Operation(summary = "Delete detection rule")
    public Mono<ResponseEntity<Void>> deleteDetectionRule(
            @Parameter(description = "Rule ID") @PathVariable String id) {
        return Mono.fromRunnable(() -> store.deleteDetectionRule(id))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    // ========== Exclusion Lists ==========

    @GetMapping("/exclusions")
    @Operation(summary = "List exclusion lists")
    public Mono<ResponseEntity<List<ExclusionList>>> listExclusions() {
        return Mono.fromCallable(store::listExclusionLists).map(ResponseEntity::ok);
    }

    @GetMapping("/exclusions/check")
    @Operation(summary = "Check target", description = "Report whether a target matches an enabled exclusion list")
    public Mono<ResponseEntity<ExclusionCheckResponse>> checkExclusion(
            @Parameter(description = "Target hostname or address") @RequestParam String target) {
        return Mono.fromCallable(() -> {
            var match = store.findExclusion(target);
            return ResponseEntity.ok(ExclusionCheckResponse.builder()
                    .target(target)
                    .excluded(match.isPresent())
                    .exclusionList(match.map(ExclusionList::getName).orElse(null))
                    .build());
        });
    }

    @GetMapping("/exclusions/{id}")
    @Operation(summary = "Get exclusion list")
    public Mono<ResponseEntity<ExclusionList>> getExclusion(
            @Parameter(description = "Exclusion list ID") @PathVariable String id) {
        return Mono.fromCallable(() -> store.getExclusionList(id)).map(ResponseEntity::ok);
    }

    @PostMapping("/exclusions")
    @Operation(summary = "Create exclusion list")
    public Mono<ResponseEntity<ExclusionList>> createExclusion(@RequestBody ExclusionList list) {
        return Mono.fromCallable(() -> store.createExclusionList(list))
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @PutMapping("/exclusions/{id}")
    @Operation(summary = "Update exclusion list")
    public Mono<ResponseEntity<ExclusionList>> updateExclusion(
            @Parameter(description = "Exclusion list ID") @PathVariable String id,
            @RequestBody ExclusionList changes) {
        return Mono.fromCallable(() -> store.updateExclusionList(id, changes)).map(ResponseEntity::ok);
    }

    @DeleteMapping("/exclusions/{id}")
    @Operation(summary = "Delete exclusion list")
    public Mono<ResponseEntity<Void>> deleteExclusion(
            @Parameter(description = "Exclusion list ID") @PathVariable String id) {
        return Mono.fromRunnable(() -> store.deleteExclusionList(id))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    // ========== Export / Import ==========

    @GetMapping("/export")
    @Operation(summary = "Export configuration")
    public Mono<ResponseEntity<ConfigurationExport>> export() {
        return Mono.fromCallable(store::exportConfiguration).map(ResponseEntity::ok);
    }

    @PostMapping("/import")
    @Operation(summary = "Import configuration",
               description = "Entries with existing ids are skipped unless overwrite is set")
    public Mono<ResponseEntity<ImportResult>> importConfiguration(
            @RequestBody ConfigurationExport document,
            @Parameter(description = "Replace entries with matching ids")
            @RequestParam(defaultValue = "false") boolean overwrite) {
        return Mono.fromCallable(() -> store.importConfiguration(document, overwrite)).map(ResponseEntity::ok);
    }

    @GetMapping("/stats")
    @Operation(summary = "Configuration statistics")
    public Mono<ResponseEntity<ConfigurationStats>> stats() {
        return Mono.fromCallable(store::getStats).map(ResponseEntity::ok);
    }
}
