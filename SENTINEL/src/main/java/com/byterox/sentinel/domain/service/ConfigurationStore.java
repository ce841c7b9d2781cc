package com.byterox.sentinel.domain.service;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.domain.model.AutomationRule;
import com.byterox.sentinel.domain.model.ConfigurationExport;
import com.byterox.sentinel.domain.model.ConfigurationStats;
import com.byterox.sentinel.domain.model.DetectionRule;
import com.byterox.sentinel.domain.model.ExclusionList;
import com.byterox.sentinel.domain.model.ImportResult;
import com.byterox.sentinel.domain.model.RuleAction;
import com.byterox.sentinel.domain.model.ScanProfile;
import com.byterox.sentinel.domain.repository.AutomationRuleRepository;
import com.byterox.sentinel.domain.repository.DetectionRuleRepository;
import com.byterox.sentinel.domain.repository.ExclusionListRepository;
import com.byterox.sentinel.domain.repository.ScanProfileRepository;
import com.byterox.sentinel.exception.NotFoundException;
import com.byterox.sentinel.exception.ValidationException;
import com.byterox.sentinel.rules.RuleValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Owns scan profiles, automation rules, detection rules and exclusion lists.
 * <p>
 * Every mutation is validated before it is stored. Engines read entries by id and only
 * touch the trigger counters through {@link #recordRuleTriggered} and
 * {@link #recordDetectionTriggered}.
 */
@Slf4j
@Service
public class ConfigurationStore {

    static final List<String> REQUIRED_PROFILE_SECTIONS = List.of("enumeration", "dns_analysis", "http_analysis");
    static final Set<String> EXCLUSION_TYPES = Set.of("global", "service", "environment", "custom");
    static final Set<String> SEVERITIES = Set.of("critical", "high", "medium", "low", "info");

    private final ScanProfileRepository profileRepository;
    private final AutomationRuleRepository automationRuleRepository;
    private final DetectionRuleRepository detectionRuleRepository;
    private final ExclusionListRepository exclusionListRepository;
    private final Clock clock;

    public ConfigurationStore(ScanProfileRepository profileRepository,
                              AutomationRuleRepository automationRuleRepository,
                              DetectionRuleRepository detectionRuleRepository,
                              ExclusionListRepository exclusionListRepository,
                              SentinelProperties properties,
                              Clock clock) {
        this.profileRepository = profileRepository;
        this.automationRuleRepository = automationRuleRepository;
        this.detectionRuleRepository = detectionRuleRepository;
        this.exclusionListRepository = exclusionListRepository;
        this.clock = clock;

        if (properties.getConfiguration().isSeedDefaults()) {
            loadDefaults();
        }
    }

    // ========== Scan Profiles ==========

    public List<ScanProfile> listProfiles() {
        return sorted(profileRepository.findAll(), ScanProfile::getCreatedAt);
    }

    public ScanProfile getProfile(String id) {
        return profileRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Scan profile", id));
    }

    public ScanProfile createProfile(ScanProfile profile) {
        validateProfile(profile);
        Instant now = clock.instant();
        profile.setId(idOrNew(profile.getId()));
        profile.setCreatedAt(now);
        profile.setUpdatedAt(now);
        log.info("Created scan profile {} ({})", profile.getId(), profile.getName());
        return profileRepository.save(profile);
    }

    public ScanProfile updateProfile(String id, ScanProfile changes) {
        ScanProfile existing = getProfile(id);
        validateProfile(changes);
        changes.setId(id);
        changes.setCreatedAt(existing.getCreatedAt());
        changes.setUpdatedAt(clock.instant());
        return profileRepository.save(changes);
    }

    public void deleteProfile(String id) {
        if (!profileRepository.delete(id)) {
            throw new NotFoundException("Scan profile", id);
        }
        log.info("Deleted scan profile {}", id);
    }

    // ========== Automation Rules ==========

    public List<AutomationRule> listAutomationRules() {
        return sorted(automationRuleRepository.findAll(), AutomationRule::getCreatedAt);
    }

    public AutomationRule getAutomationRule(String id) {
        return automationRuleRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Automation rule", id));
    }

    public Optional<AutomationRule> findAutomationRule(String id) {
        return automationRuleRepository.findById(id);
    }

    public AutomationRule createAutomationRule(AutomationRule rule) {
        validateAutomationRule(rule);
        Instant now = clock.instant();
        rule.setId(idOrNew(rule.getId()));
        rule.setTriggeredCount(0);
        rule.setLastTriggeredAt(null);
        rule.setCreatedAt(now);
        rule.setUpdatedAt(now);
        log.info("Created automation rule {} ({})", rule.getId(), rule.getName());
        return automationRuleRepository.save(rule);
    }

    public AutomationRule updateAutomationRule(String id, AutomationRule changes) {
        validateAutomationRule(changes);
        return automationRuleRepository.update(id, existing -> {
                    existing.setName(changes.getName());
                    existing.setDescription(changes.getDescription());
                    existing.setCondition(changes.getCondition());
                    existing.setAction(changes.getAction());
                    existing.setEnabled(changes.isEnabled());
                    existing.setUpdatedAt(clock.instant());
                    return existing;
                })
                .orElseThrow(() -> new NotFoundException("Automation rule", id));
    }

    public void deleteAutomationRule(String id) {
        if (!automationRuleRepository.delete(id)) {
            throw new NotFoundException("Automation rule", id);
        }
        log.info("Deleted automation rule {}", id);
    }

    /**
     * Increment the trigger counter of a rule. Unknown ids are ignored; the rule may
     * have been deleted while a tick was running.
     */
    public Optional<AutomationRule> recordRuleTriggered(String id) {
        Instant now = clock.instant();
        return automationRuleRepository.update(id, rule -> {
            rule.setTriggeredCount(rule.getTriggeredCount() + 1);
            rule.setLastTriggeredAt(now);
            return rule;
        });
    }

    public void validateAutomationRule(AutomationRule rule) {
        List<String> errors = new ArrayList<>();
        if (rule == null) {
            throw ValidationException.of("automation rule", List.of("rule is required"));
        }
        if (RuleValidator.isBlank(rule.getName())) {
            errors.add("name is required");
        }
        RuleValidator.validateCondition(rule.getCondition(), "condition", true, errors);
        RuleValidator.validateAction(rule.getAction(), "action", errors);
        throwIfInvalid("automation rule", errors);
    }

    // ========== Detection Rules ==========

    public List<DetectionRule> listDetectionRules() {
        return sorted(detectionRuleRepository.findAll(), DetectionRule::getCreatedAt);
    }

    public List<DetectionRule> listEnabledDetectionRules() {
        return listDetectionRules().stream().filter(DetectionRule::isEnabled).toList();
    }

    public DetectionRule getDetectionRule(String id) {
        return detectionRuleRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Detection rule", id));
    }

    public DetectionRule createDetectionRule(DetectionRule rule) {
        validateDetectionRule(rule);
        Instant now = clock.instant();
        rule.setId(idOrNew(rule.getId()));
        rule.setTriggeredCount(0);
        rule.setCreatedAt(now);
        rule.setUpdatedAt(now);
        return detectionRuleRepository.save(rule);
    }

    public DetectionRule updateDetectionRule(String id, DetectionRule changes) {
        validateDetectionRule(changes);
        return detectionRuleRepository.update(id, existing -> {
                    existing.setName(changes.getName());
                    existing.setDescription(changes.getDescription());
                    existing.setCategory(changes.getCategory());
                    existing.setSeverity(changes.getSeverity());
                    existing.setConditions(changes.getConditions());
                    existing.setActions(changes.getActions());
                    existing.setEnabled(changes.isEnabled());
                    existing.setUpdatedAt(clock.instant());
                    return existing;
                })
                .orElseThrow(() -> new NotFoundException("Detection rule", id));
    }

    public void deleteDetectionRule(String id) {
        if (!detectionRuleRepository.delete(id)) {
            throw new NotFoundException("Detection rule", id);
        }
    }

    public Optional<DetectionRule> recordDetectionTriggered(String id) {
        Instant now = clock.instant();
        return detectionRuleRepository.update(id, rule -> {
            rule.setTriggeredCount(rule.getTriggeredCount() + 1);
            rule.setLastTriggeredAt(now);
            return rule;
        });
    }

    // ========== Exclusion Lists ==========

    public List<ExclusionList> listExclusionLists() {
        return sorted(exclusionListRepository.findAll(), ExclusionList::getCreatedAt);
    }

    public ExclusionList getExclusionList(String id) {
        return exclusionListRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Exclusion list", id));
    }

    public ExclusionList createExclusionList(ExclusionList list) {
        validateExclusionList(list);
        Instant now = clock.instant();
        list.setId(idOrNew(list.getId()));
        list.setCreatedAt(now);
        list.setUpdatedAt(now);
        log.info("Created exclusion list {} ({})", list.getId(), list.getName());
        return exclusionListRepository.save(list);
    }

    public ExclusionList updateExclusionList(String id, ExclusionList changes) {
        ExclusionList existing = getExclusionList(id);
        validateExclusionList(changes);
        changes.setId(id);
        changes.setCreatedAt(existing.getCreatedAt());
        changes.setUpdatedAt(clock.instant());
        return exclusionListRepository.save(changes);
    }

    public void deleteExclusionList(String id) {
        if (!exclusionListRepository.delete(id)) {
            throw new NotFoundException("Exclusion list", id);
        }
    }

    /**
     * @return the first enabled list excluding the target, if any
     */
    public Optional<ExclusionList> findExclusion(String target) {
        return listExclusionLists().stream()
                .filter(ExclusionList::isEnabled)
                .filter(list -> ExclusionMatcher.matches(list, target))
                .findFirst();
    }

    public boolean shouldExcludeTarget(String target) {
        return findExclusion(target).isPresent();
    }

    // ========== Import / Export ==========

    public ConfigurationExport exportConfiguration() {
        return ConfigurationExport.builder()
                .exportedAt(clock.instant())
                .scanProfiles(listProfiles())
                .automationRules(listAutomationRules())
                .detectionRules(listDetectionRules())
                .exclusionLists(listExclusionLists())
                .build();
    }

    public ImportResult importConfiguration(ConfigurationExport document, boolean overwrite) {
        ImportResult result = new ImportResult();
        if (document == null) {
            return result;
        }
        Instant now = clock.instant();
        for (ScanProfile profile : nullSafe(document.getScanProfiles())) {
            importEntry(result, "scan profile", profile.getId(), overwrite,
                    profileRepository.existsById(profile.getId()),
                    () -> validateProfile(profile),
                    id -> {
                        profile.setId(id);
                        stamp(profile::setCreatedAt, profile.getCreatedAt(), now);
                        profile.setUpdatedAt(now);
                        profileRepository.save(profile);
                    });
        }
        for (AutomationRule rule : nullSafe(document.getAutomationRules())) {
            importEntry(result, "automation rule", rule.getId(), overwrite,
                    automationRuleRepository.existsById(rule.getId()),
                    () -> validateAutomationRule(rule),
                    id -> {
                        rule.setId(id);
                        stamp(rule::setCreatedAt, rule.getCreatedAt(), now);
                        rule.setUpdatedAt(now);
                        automationRuleRepository.save(rule);
                    });
        }
        for (DetectionRule rule : nullSafe(document.getDetectionRules())) {
            importEntry(result, "detection rule", rule.getId(), overwrite,
                    detectionRuleRepository.existsById(rule.getId()),
                    () -> validateDetectionRule(rule),
                    id -> {
                        rule.setId(id);
                        stamp(rule::setCreatedAt, rule.getCreatedAt(), now);
                        rule.setUpdatedAt(now);
                        detectionRuleRepository.save(rule);
                    });
        }
        for (ExclusionList list : nullSafe(document.getExclusionLists())) {
            importEntry(result, "exclusion list", list.getId(), overwrite,
                    exclusionListRepository.existsById(list.getId()),
                    () -> validateExclusionList(list),
                    id -> {
                        list.setId(id);
                        stamp(list::setCreatedAt, list.getCreatedAt(), now);
                        list.setUpdatedAt(now);
                        exclusionListRepository.save(list);
                    });
        }
        log.info("Imported configuration: imported={}, skipped={}, errors={}",
                result.getImported(), result.getSkipped(), result.getErrors().size());
        return result;
    }

    public ConfigurationStats getStats() {
        List<AutomationRule> rules = automationRuleRepository.findAll();
        List<DetectionRule> detections = detectionRuleRepository.findAll();
        List<ExclusionList> exclusions = exclusionListRepository.findAll();
        return ConfigurationStats.builder()
                .scanProfiles(profileRepository.count())
                .automationRules(rules.size())
                .enabledAutomationRules(rules.stream().filter(AutomationRule::isEnabled).count())
                .detectionRules(detections.size())
                .enabledDetectionRules(detections.stream().filter(DetectionRule::isEnabled).count())
                .exclusionLists(exclusions.size())
                .enabledExclusionLists(exclusions.stream().filter(ExclusionList::isEnabled).count())
                .totalRuleTriggers(rules.stream().mapToLong(AutomationRule::getTriggeredCount).sum())
                .build();
    }

    // ========== Private Methods ==========

    private void loadDefaults() {
        Instant now = clock.instant();
        ConfigurationDefaults.scanProfiles(now).forEach(profileRepository::save);
        ConfigurationDefaults.detectionRules(now).forEach(detectionRuleRepository::save);
        ConfigurationDefaults.exclusionLists(now).forEach(exclusionListRepository::save);
        log.info("Loaded default configuration: profiles={}, detectionRules={}, exclusionLists={}",
                profileRepository.count(), detectionRuleRepository.count(), exclusionListRepository.count());
    }

    private void validateProfile(ScanProfile profile) {
        List<String> errors = new ArrayList<>();
        if (profile == null) {
            throw ValidationException.of("scan profile", List.of("profile is required"));
        }
        if (RuleValidator.isBlank(profile.getName())) {
            errors.add("name is required");
        }
        Map<String, Object> config = profile.getConfig() != null ? profile.getConfig() : new HashMap<>();
        for (String section : REQUIRED_PROFILE_SECTIONS) {
            if (!config.containsKey(section)) {
                errors.add("missing required config section: " + section);
            }
        }
        throwIfInvalid("scan profile", errors);
    }

    private void validateDetectionRule(DetectionRule rule) {
        List<String> errors = new ArrayList<>();
        if (rule == null) {
            throw ValidationException.of("detection rule", List.of("rule is required"));
        }
        if (RuleValidator.isBlank(rule.getName())) {
            errors.add("name is required");
        }
        if (rule.getSeverity() == null || !SEVERITIES.contains(rule.getSeverity())) {
            errors.add("severity must be one of " + SEVERITIES);
        }
        if (rule.getConditions() == null || rule.getConditions().isEmpty()) {
            errors.add("at least one condition is required");
        } else {
            for (int i = 0; i < rule.getConditions().size(); i++) {
                RuleValidator.validateCondition(rule.getConditions().get(i), "conditions[" + i + "]", true, errors);
            }
        }
        List<RuleAction> actions = nullSafe(rule.getActions());
        for (int i = 0; i < actions.size(); i++) {
            RuleValidator.validateAction(actions.get(i), "actions[" + i + "]", errors);
        }
        throwIfInvalid("detection rule", errors);
    }

    private void validateExclusionList(ExclusionList list) {
        List<String> errors = new ArrayList<>();
        if (list == null) {
            throw ValidationException.of("exclusion list", List.of("list is required"));
        }
        if (RuleValidator.isBlank(list.getName())) {
            errors.add("name is required");
        }
        if (list.getType() == null || !EXCLUSION_TYPES.contains(list.getType())) {
            errors.add("type must be one of " + EXCLUSION_TYPES);
        }
        for (String ip : nullSafe(list.getIps())) {
            if (!ExclusionMatcher.isValidIpEntry(ip)) {
                errors.add("invalid IP or CIDR entry: " + ip);
            }
        }
        for (Integer port : nullSafe(list.getPorts())) {
            if (port == null || port < 1 || port > 65535) {
                errors.add("invalid port: " + port);
            }
        }
        throwIfInvalid("exclusion list", errors);
    }

    private void importEntry(ImportResult result, String kind, String id, boolean overwrite, boolean exists,
                             Runnable validation, Consumer<String> store) {
        if (exists && !overwrite) {
            result.setSkipped(result.getSkipped() + 1);
            return;
        }
        try {
            validation.run();
            store.accept(idOrNew(id));
            result.setImported(result.getImported() + 1);
        } catch (ValidationException e) {
            result.getErrors().add(kind + " " + id + ": " + e.getMessage());
        }
    }

    private static void stamp(Consumer<Instant> setter, Instant current, Instant now) {
        setter.accept(current != null ? current : now);
    }

    private static void throwIfInvalid(String subject, List<String> errors) {
        if (!errors.isEmpty()) {
            throw ValidationException.of(subject, errors);
        }
    }

    private static String idOrNew(String id) {
        return RuleValidator.isBlank(id) ? UUID.randomUUID().toString() : id;
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }

    private static <T> List<T> sorted(List<T> items, Function<T, Instant> createdAt) {
        return items.stream()
                .sorted(Comparator.comparing(createdAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }
}
