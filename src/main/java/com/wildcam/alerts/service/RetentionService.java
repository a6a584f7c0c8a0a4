package com.wildcam.alerts.service;

import com.wildcam.alerts.config.AlertEngineProperties;
import com.wildcam.alerts.config.MetricsConfig;
import com.wildcam.alerts.exception.PersistenceBatchException;
import com.wildcam.alerts.model.Alert;
import com.wildcam.alerts.repository.AlertRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Purges resolved alerts older than the retention period.
 */
@Service
public class RetentionService {

    private static final Logger log = LoggerFactory.getLogger(RetentionService.class);

    private final AlertRepository alertRepository;
    private final AlertEngineProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public RetentionService(AlertRepository alertRepository, AlertEngineProperties properties,
                            MetricsConfig metricsConfig, Clock clock) {
        this.alertRepository = alertRepository;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Scheduled(cron = "${alerts.retention.cron:0 30 3 * * *}", zone = "UTC")
    public void scheduledCleanup() {
        try {
            cleanupOldAlerts(properties.getRetention().getDaysToKeep());
        } catch (PersistenceBatchException e) {
            log.error("Retention sweep rolled back: {}", e.getMessage(), e);
        }
    }

    /**
     * Delete alerts resolved more than {@code daysToKeep} days ago. If any delete
     * fails, alerts already deleted in this run are written back.
     *
     * @return number of alerts deleted
     * @throws PersistenceBatchException if the batch could not be completed
     */
    public int cleanupOldAlerts(int daysToKeep) {
        if (daysToKeep < 0) {
            throw new IllegalArgumentException("daysToKeep must be >= 0, got " + daysToKeep);
        }
        long cutoff = clock.millis() - Duration.ofDays(daysToKeep).toMillis();
        List<Alert> expired = alertRepository.findResolvedBefore(cutoff);

        List<Alert> deleted = new ArrayList<>();
        try {
            for (Alert alert : expired) {
                alertRepository.delete(alert.getAlertId());
                deleted.add(alert);
            }
        } catch (Exception e) {
            int completed = deleted.size();
            restore(deleted, e);
            throw new PersistenceBatchException("Retention sweep failed after " + completed
                    + " of " + expired.size() + " deletes", completed, e);
        }

        metricsConfig.recordRetentionDeleted(deleted.size());
        log.info("Retention sweep deleted {} alerts resolved before {} days ago", deleted.size(), daysToKeep);
        return deleted.size();
    }

    private void restore(List<Alert> deleted, Exception cause) {
        for (Alert alert : deleted) {
            try {
                alertRepository.save(alert);
            } catch (Exception e) {
                cause.addSuppressed(e);
                log.error("Failed to restore alert {} after aborted sweep: {}", alert.getAlertId(), e.getMessage());
            }
        }
    }
}
