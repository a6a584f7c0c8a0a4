package com.wildcam.alerts.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.wildcam.alerts.config.AerospikeConfig;
import com.wildcam.alerts.model.DeliveryChannel;
import com.wildcam.alerts.model.DeliveryRecord;
import com.wildcam.alerts.model.DeliveryStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class DeliveryRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(DeliveryRecordRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public DeliveryRecordRepository(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace,
                                    @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    /**
     * Upsert under the record's deterministic key, so a re-run job replaces its earlier outcome.
     */
    public void save(DeliveryRecord record) {
        Key key = new Key(namespace, AerospikeConfig.SET_DELIVERIES, record.key());
        client.put(writePolicy, key,
                new Bin("alertId", record.getAlertId()),
                new Bin("channel", record.getChannel().name()),
                new Bin("target", record.getTarget() != null ? record.getTarget() : ""),
                new Bin("status", record.getStatus().name()),
                new Bin("attempts", record.getAttempts()),
                new Bin("lastError", record.getLastError() != null ? record.getLastError() : ""),
                new Bin("completedAt", record.getCompletedAt()));
    }

    public List<DeliveryRecord> findByAlertId(String alertId) {
        List<DeliveryRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DELIVERIES,
                (key, rec) -> {
                    try {
                        if (!alertId.equals(rec.getString("alertId"))) return;
                        String lastError = rec.getString("lastError");
                        DeliveryRecord record = DeliveryRecord.builder()
                                .alertId(alertId)
                                .channel(DeliveryChannel.valueOf(rec.getString("channel")))
                                .target(rec.getString("target"))
                                .status(DeliveryStatus.valueOf(rec.getString("status")))
                                .attempts(rec.getInt("attempts"))
                                .lastError(lastError == null || lastError.isEmpty() ? null : lastError)
                                .completedAt(rec.getLong("completedAt"))
                                .build();
                        synchronized (results) {
                            results.add(record);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read delivery record: {}", e.getMessage());
                    }
                });
        results.sort(Comparator.comparingLong(DeliveryRecord::getCompletedAt));
        return results;
    }
}
