package com.wildcam.alerts.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.wildcam.alerts.config.AerospikeConfig;
import com.wildcam.alerts.model.AlertRule;
import com.wildcam.alerts.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Alert rules with an in-memory cache of all rules, refreshed on a schedule by
 * {@link com.wildcam.alerts.service.DeliveryCoordinator} and after every write.
 */
@Repository
public class AlertRuleRepository {

    private static final Logger log = LoggerFactory.getLogger(AlertRuleRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    private final AtomicReference<List<AlertRule>> cachedRules = new AtomicReference<>(new CopyOnWriteArrayList<>());

    public AlertRuleRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                               @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void refreshCache() {
        try {
            List<AlertRule> allRules = scanAllRules();
            cachedRules.set(new CopyOnWriteArrayList<>(allRules));
            log.debug("Alert rule cache refreshed, {} rules loaded", allRules.size());
        } catch (Exception e) {
            log.error("Failed to refresh alert rule cache", e);
        }
    }

    public List<AlertRule> findActiveGlobal() {
        return cachedRules.get().stream()
                .filter(AlertRule::isActive)
                .filter(AlertRule::isGlobal)
                .toList();
    }

    public List<AlertRule> findActiveForCamera(String cameraId) {
        if (cameraId == null) return List.of();
        return cachedRules.get().stream()
                .filter(AlertRule::isActive)
                .filter(rule -> cameraId.equals(rule.getCameraId()))
                .toList();
    }

    public List<AlertRule> findAll() {
        return scanAllRules();
    }

    public AlertRule findById(String ruleId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERT_RULES, ruleId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecordToRule(record);
    }

    public void save(AlertRule rule) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERT_RULES, rule.getRuleId());

        client.put(writePolicy, key,
                new Bin("ruleId", rule.getRuleId()),
                new Bin("userId", rule.getUserId()),
                new Bin("cameraId", rule.getCameraId() != null ? rule.getCameraId() : ""),
                new Bin("active", rule.isActive()),
                new Bin("severities", join(rule.getSeverityLevels(), Severity::name)),
                new Bin("species", join(rule.getSpeciesFilter(), Function.identity())),
                new Bin("minConfidence", rule.getMinConfidence()),
                new Bin("hours", join(rule.getTimeOfDay(), String::valueOf)),
                new Bin("days", join(rule.getDaysOfWeek(), DayOfWeek::name)),
                new Bin("emailEnabled", rule.isEmailEnabled()),
                new Bin("emailAddress", nullToEmpty(rule.getEmailAddress())),
                new Bin("pushEnabled", rule.isPushEnabled()),
                new Bin("webhookUrl", nullToEmpty(rule.getWebhookUrl())),
                new Bin("smsEnabled", rule.isSmsEnabled()),
                new Bin("phoneNumber", nullToEmpty(rule.getPhoneNumber())),
                new Bin("suppressFp", rule.isSuppressFalsePositives()));

        refreshCache();
    }

    public boolean delete(String ruleId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERT_RULES, ruleId);
        boolean deleted = client.delete(writePolicy, key);
        if (deleted) {
            refreshCache();
        }
        return deleted;
    }

    private List<AlertRule> scanAllRules() {
        List<AlertRule> rules = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ALERT_RULES,
                (key, record) -> {
                    try {
                        if (record.getString("ruleId") != null) {
                            synchronized (rules) {
                                rules.add(mapRecordToRule(record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize alert rule record: {}", e.getMessage());
                    }
                });
        return rules;
    }

    private AlertRule mapRecordToRule(Record record) {
        String cameraId = record.getString("cameraId");
        return AlertRule.builder()
                .ruleId(record.getString("ruleId"))
                .userId(record.getString("userId"))
                .cameraId(cameraId == null || cameraId.isEmpty() ? null : cameraId)
                .active(record.getBoolean("active"))
                .severityLevels(split(record.getString("severities"), Severity::valueOf))
                .speciesFilter(split(record.getString("species"), Function.identity()))
                .minConfidence(record.getDouble("minConfidence"))
                .timeOfDay(split(record.getString("hours"), Integer::valueOf))
                .daysOfWeek(split(record.getString("days"), DayOfWeek::valueOf))
                .emailEnabled(record.getBoolean("emailEnabled"))
                .emailAddress(emptyToNull(record.getString("emailAddress")))
                .pushEnabled(record.getBoolean("pushEnabled"))
                .webhookUrl(emptyToNull(record.getString("webhookUrl")))
                .smsEnabled(record.getBoolean("smsEnabled"))
                .phoneNumber(emptyToNull(record.getString("phoneNumber")))
                .suppressFalsePositives(record.getBoolean("suppressFp"))
                .build();
    }

    private static <T> String join(Set<T> values, Function<T, String> toText) {
        if (values == null || values.isEmpty()) return "";
        return values.stream().map(toText).collect(Collectors.joining(","));
    }

    private static <T> Set<T> split(String csv, Function<String, T> parse) {
        if (csv == null || csv.isEmpty()) return new HashSet<>();
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(parse)
                .collect(Collectors.toCollection(HashSet::new));
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
