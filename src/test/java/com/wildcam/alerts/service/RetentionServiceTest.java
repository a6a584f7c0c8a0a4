package com.wildcam.alerts.service;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.ResultCode;
import com.wildcam.alerts.config.AlertEngineProperties;
import com.wildcam.alerts.config.MetricsConfig;
import com.wildcam.alerts.exception.PersistenceBatchException;
import com.wildcam.alerts.model.Alert;
import com.wildcam.alerts.repository.AlertRepository;
import com.wildcam.alerts.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetentionServiceTest {

    @Mock private AlertRepository alertRepository;
    @Mock private MetricsConfig metricsConfig;

    private final Clock clock = TestDataFactory.fixedClock("2024-09-01T00:00:00Z");

    private RetentionService retentionService;
    private Alert resolved91DaysAgo;
    private Alert resolved89DaysAgo;

    @BeforeEach
    void setUp() {
        retentionService = new RetentionService(alertRepository, new AlertEngineProperties(), metricsConfig, clock);
        resolved91DaysAgo = TestDataFactory.createResolvedAlert("ALT-OLD", daysAgo(91));
        resolved89DaysAgo = TestDataFactory.createResolvedAlert("ALT-RECENT", daysAgo(89));
    }

    @Test
    void cleanup_ninetyDays_deletesOnlyAlertsResolvedBeforeCutoff() {
        List<Alert> stored = List.of(resolved91DaysAgo, resolved89DaysAgo);
        when(alertRepository.findResolvedBefore(anyLong())).thenAnswer(invocation -> {
            long cutoff = invocation.getArgument(0);
            return stored.stream().filter(a -> a.getResolvedAt() < cutoff).toList();
        });
        when(alertRepository.delete("ALT-OLD")).thenReturn(true);

        int deleted = retentionService.cleanupOldAlerts(90);

        assertThat(deleted).isEqualTo(1);
        verify(alertRepository).findResolvedBefore(daysAgo(90));
        verify(alertRepository).delete("ALT-OLD");
        verify(alertRepository, never()).delete("ALT-RECENT");
        verify(metricsConfig).recordRetentionDeleted(1);
    }

    @Test
    void cleanup_deleteFails_restoresAlreadyDeletedAndThrows() {
        Alert third = TestDataFactory.createResolvedAlert("ALT-OLDER", daysAgo(120));
        when(alertRepository.findResolvedBefore(anyLong())).thenReturn(List.of(third, resolved91DaysAgo));
        when(alertRepository.delete("ALT-OLDER")).thenReturn(true);
        when(alertRepository.delete("ALT-OLD")).thenThrow(new AerospikeException(ResultCode.TIMEOUT));

        assertThatThrownBy(() -> retentionService.cleanupOldAlerts(90))
                .isInstanceOf(PersistenceBatchException.class)
                .satisfies(e -> assertThat(((PersistenceBatchException) e).getCompletedBeforeFailure()).isEqualTo(1));

        verify(alertRepository).save(third);
        verify(alertRepository, never()).save(resolved91DaysAgo);
        verify(metricsConfig, never()).recordRetentionDeleted(anyInt());
    }

    @Test
    void cleanup_negativeDays_rejected() {
        assertThatThrownBy(() -> retentionService.cleanupOldAlerts(-1))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(alertRepository);
    }

    @Test
    void scheduledCleanup_usesConfiguredRetention() {
        when(alertRepository.findResolvedBefore(anyLong())).thenReturn(List.of());

        retentionService.scheduledCleanup();

        verify(alertRepository).findResolvedBefore(daysAgo(90));
        verify(metricsConfig).recordRetentionDeleted(0);
    }

    private long daysAgo(int days) {
        return clock.millis() - Duration.ofDays(days).toMillis();
    }
}
