package com.wildcam.alerts.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.wildcam.alerts.config.AerospikeConfig;
import com.wildcam.alerts.model.AlertMetrics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * Daily per-camera alert counters, keyed by {@code cameraId:date}.
 */
@Repository
public class AlertMetricsRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AlertMetricsRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * Atomically bump the creation counters for one alert.
     */
    public void incrementCounters(String cameraId, String date, boolean filtered, boolean falsePositive) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERT_METRICS, AlertMetrics.keyOf(cameraId, date));

        client.operate(writePolicy, key,
                Operation.put(new Bin("cameraId", cameraId)),
                Operation.put(new Bin("date", date)),
                Operation.add(new Bin("totalAlerts", 1L)),
                Operation.add(new Bin("filteredAlerts", filtered ? 1L : 0L)),
                Operation.add(new Bin("sentAlerts", filtered ? 0L : 1L)),
                Operation.add(new Bin("fpCount", falsePositive ? 1L : 0L)));
    }

    public AlertMetrics find(String cameraId, String date) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERT_METRICS, AlertMetrics.keyOf(cameraId, date));
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return AlertMetrics.builder()
                .cameraId(cameraId)
                .date(date)
                .totalAlerts(record.getLong("totalAlerts"))
                .filteredAlerts(record.getLong("filteredAlerts"))
                .sentAlerts(record.getLong("sentAlerts"))
                .falsePositiveCount(record.getLong("fpCount"))
                .mlAccuracy(record.getDouble("mlAccuracy"))
                .falsePositiveRate(record.getDouble("fpRate"))
                .feedbackCount(record.getLong("feedbackCount"))
                .build();
    }

    /**
     * Write the feedback-derived bins only. The creation counters belong to
     * {@link #incrementCounters} and are never rewritten from a snapshot.
     */
    public void saveAccuracy(AlertMetrics metrics) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERT_METRICS, metrics.key());

        client.operate(writePolicy, key,
                Operation.put(new Bin("cameraId", metrics.getCameraId())),
                Operation.put(new Bin("date", metrics.getDate())),
                Operation.put(new Bin("mlAccuracy", metrics.getMlAccuracy())),
                Operation.put(new Bin("fpRate", metrics.getFalsePositiveRate())),
                Operation.put(new Bin("feedbackCount", metrics.getFeedbackCount())));
    }
}
