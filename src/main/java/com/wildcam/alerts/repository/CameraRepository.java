package com.wildcam.alerts.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.wildcam.alerts.config.AerospikeConfig;
import com.wildcam.alerts.model.Camera;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

@Repository
public class CameraRepository {

    private static final Logger log = LoggerFactory.getLogger(CameraRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public CameraRepository(AerospikeClient client,
                            @Qualifier("aerospikeNamespace") String namespace,
                            @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void save(Camera camera) {
        Key key = new Key(namespace, AerospikeConfig.SET_CAMERAS, camera.getCameraId());
        client.put(writePolicy, key,
                new Bin("cameraId", camera.getCameraId()),
                new Bin("name", camera.getName()),
                new Bin("locationName", camera.getLocationName()),
                new Bin("status", camera.getStatus()));
    }

    public List<Camera> findActive() {
        List<Camera> cameras = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CAMERAS,
                (key, record) -> {
                    try {
                        Camera camera = Camera.builder()
                                .cameraId(record.getString("cameraId"))
                                .name(record.getString("name"))
                                .locationName(record.getString("locationName"))
                                .status(record.getString("status"))
                                .build();
                        if (camera.isActive()) {
                            synchronized (cameras) {
                                cameras.add(camera);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read camera record: {}", e.getMessage());
                    }
                });
        return cameras;
    }
}
