package com.wildcam.alerts.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wildcam.alerts.config.AerospikeConfig;
import com.wildcam.alerts.model.Alert;
import com.wildcam.alerts.model.Recommendation;
import com.wildcam.alerts.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

@Repository
public class AlertRepository {

    private static final Logger log = LoggerFactory.getLogger(AlertRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AlertRepository(AerospikeClient client,
                           @Qualifier("aerospikeNamespace") String namespace,
                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                           @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(Alert alert) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERTS, alert.getAlertId());

        client.put(writePolicy, key,
                new Bin("alertId", alert.getAlertId()),
                new Bin("detectionId", alert.getDetectionId()),
                new Bin("cameraId", alert.getCameraId()),
                new Bin("species", alert.getSpecies()),
                new Bin("alertType", alert.getAlertType()),
                new Bin("severity", alert.getSeverity() != null ? alert.getSeverity().name() : ""),
                new Bin("priority", alert.getPriority()),
                new Bin("title", alert.getTitle()),
                new Bin("message", alert.getMessage()),
                new Bin("data", serializeData(alert.getData())),
                new Bin("mlConfidence", alert.getMlConfidence()),
                new Bin("fpScore", alert.getFalsePositiveScore()),
                new Bin("anomalyScore", alert.getAnomalyScore()),
                new Bin("temporalScore", alert.getTemporalScore()),
                // -1 = no feedback yet
                new Bin("userFp", alert.getUserFalsePositive() == null ? -1 : (alert.getUserFalsePositive() ? 1 : 0)),
                new Bin("filtered", alert.isFiltered()),
                new Bin("filterReason", alert.getFilterReason() != null ? alert.getFilterReason() : ""),
                new Bin("recommendation", alert.getRecommendation() != null ? alert.getRecommendation().name() : ""),
                new Bin("corrGroup", alert.getCorrelationGroup() != null ? alert.getCorrelationGroup() : ""),
                new Bin("duplicateOf", alert.getDuplicateOf() != null ? alert.getDuplicateOf() : ""),
                new Bin("createdAt", alert.getCreatedAt()),
                new Bin("acknowledged", alert.isAcknowledged()),
                new Bin("acknowledgedAt", alert.getAcknowledgedAt()),
                new Bin("resolved", alert.isResolved()),
                new Bin("resolvedAt", alert.getResolvedAt()));
    }

    public Alert findById(String alertId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERTS, alertId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public boolean delete(String alertId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERTS, alertId);
        return client.delete(writePolicy, key);
    }

    /**
     * Unresolved, unfiltered alerts, newest first.
     */
    public List<Alert> findActive(String cameraId, Severity severity, int limit) {
        List<Alert> results = scan(alert -> !alert.isResolved() && !alert.isFiltered()
                && (cameraId == null || cameraId.isEmpty() || cameraId.equals(alert.getCameraId()))
                && (severity == null || severity == alert.getSeverity()));
        results.sort(Comparator.comparingLong(Alert::getCreatedAt).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    public List<Alert> findResolvedBefore(long cutoffMillis) {
        return scan(alert -> alert.isResolved() && alert.getResolvedAt() < cutoffMillis);
    }

    /**
     * Alerts for a camera created in [fromMillis, toMillis) that carry user feedback.
     */
    public List<Alert> findWithFeedback(String cameraId, long fromMillis, long toMillis) {
        return scan(alert -> cameraId.equals(alert.getCameraId())
                && alert.getUserFalsePositive() != null
                && alert.getCreatedAt() >= fromMillis
                && alert.getCreatedAt() < toMillis);
    }

    /**
     * Alerts of one species on one camera created at or after {@code sinceMillis}, newest first.
     */
    public List<Alert> findRecent(String cameraId, String species, long sinceMillis) {
        List<Alert> results = scan(alert -> cameraId.equals(alert.getCameraId())
                && species.equals(alert.getSpecies())
                && alert.getCreatedAt() >= sinceMillis);
        results.sort(Comparator.comparingLong(Alert::getCreatedAt).reversed());
        return results;
    }

    private List<Alert> scan(Predicate<Alert> filter) {
        List<Alert> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ALERTS,
                (key, record) -> {
                    try {
                        Alert alert = mapRecord(record);
                        if (filter.test(alert)) {
                            synchronized (results) {
                                results.add(alert);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read alert record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private Alert mapRecord(Record record) {
        long userFp = record.getLong("userFp");
        String severity = record.getString("severity");
        String recommendation = record.getString("recommendation");

        return Alert.builder()
                .alertId(record.getString("alertId"))
                .detectionId(record.getString("detectionId"))
                .cameraId(record.getString("cameraId"))
                .species(record.getString("species"))
                .alertType(record.getString("alertType"))
                .severity(severity == null || severity.isEmpty() ? null : Severity.valueOf(severity))
                .priority(record.getString("priority"))
                .title(record.getString("title"))
                .message(record.getString("message"))
                .data(deserializeData(record.getString("data")))
                .mlConfidence(record.getDouble("mlConfidence"))
                .falsePositiveScore(record.getDouble("fpScore"))
                .anomalyScore(record.getDouble("anomalyScore"))
                .temporalScore(record.getDouble("temporalScore"))
                .userFalsePositive(userFp < 0 ? null : userFp == 1)
                .filtered(record.getBoolean("filtered"))
                .filterReason(emptyToNull(record.getString("filterReason")))
                .recommendation(recommendation == null || recommendation.isEmpty()
                        ? null : Recommendation.valueOf(recommendation))
                .correlationGroup(emptyToNull(record.getString("corrGroup")))
                .duplicateOf(emptyToNull(record.getString("duplicateOf")))
                .createdAt(record.getLong("createdAt"))
                .acknowledged(record.getBoolean("acknowledged"))
                .acknowledgedAt(record.getLong("acknowledgedAt"))
                .resolved(record.getBoolean("resolved"))
                .resolvedAt(record.getLong("resolvedAt"))
                .build();
    }

    private String serializeData(Map<String, Object> data) {
        if (data == null) return "{}";
        try {
            return objectMapper.writeValueAsString(data);
        } catch (Exception e) {
            log.warn("Failed to serialize alert data, storing empty map: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> deserializeData(String json) {
        if (json == null || json.isEmpty()) return new HashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            log.warn("Failed to deserialize alert data: {}", e.getMessage());
            return new HashMap<>();
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
