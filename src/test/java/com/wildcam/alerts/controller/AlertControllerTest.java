package com.wildcam.alerts.controller;

import com.wildcam.alerts.exception.AlertNotFoundException;
import com.wildcam.alerts.model.Alert;
import com.wildcam.alerts.model.DeliveryChannel;
import com.wildcam.alerts.model.DeliveryRecord;
import com.wildcam.alerts.model.DeliveryStatus;
import com.wildcam.alerts.model.Severity;
import com.wildcam.alerts.service.AlertService;
import com.wildcam.alerts.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AlertController.class)
class AlertControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AlertService alertService;

    @Test
    void getAlert_found() throws Exception {
        when(alertService.getAlert("ALT-1")).thenReturn(TestDataFactory.createAlert("ALT-1", Severity.CRITICAL, false));

        mockMvc.perform(get("/api/v1/alerts/ALT-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alertId").value("ALT-1"))
                .andExpect(jsonPath("$.severity").value("CRITICAL"))
                .andExpect(jsonPath("$.isFiltered").value(false));
    }

    @Test
    void getAlert_notFound() throws Exception {
        when(alertService.getAlert("ALT-404")).thenThrow(new AlertNotFoundException("ALT-404"));

        mockMvc.perform(get("/api/v1/alerts/ALT-404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ALERT_NOT_FOUND"));
    }

    @Test
    void getActiveAlerts_withFilters() throws Exception {
        when(alertService.getActiveAlerts(eq("CAM-1"), eq(Severity.CRITICAL), eq(10)))
                .thenReturn(List.of(TestDataFactory.createAlert("ALT-2", Severity.CRITICAL, false)));

        mockMvc.perform(get("/api/v1/alerts?cameraId=CAM-1&severity=critical&limit=10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray())
                .andExpect(jsonPath("$[0].alertId").value("ALT-2"));
    }

    @Test
    void getActiveAlerts_unknownSeverity_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/alerts?severity=apocalyptic"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(alertService);
    }

    @Test
    void getActiveAlerts_nonPositiveLimit_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/alerts?limit=0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void submitFeedback_success() throws Exception {
        Alert alert = TestDataFactory.createAlert("ALT-3", Severity.WARNING, false);
        alert.setUserFalsePositive(true);
        when(alertService.processFeedback("ALT-3", true)).thenReturn(alert);

        mockMvc.perform(post("/api/v1/alerts/ALT-3/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"isFalsePositive\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userFalsePositive").value(true));
    }

    @Test
    void submitFeedback_missingFlag_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/alerts/ALT-3/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"isFalsePositive\": \"maybe\"}"))
                .andExpect(status().isBadRequest());

        verify(alertService, never()).processFeedback(anyString(), anyBoolean());
    }

    @Test
    void acknowledge_success() throws Exception {
        Alert alert = TestDataFactory.createAlert("ALT-4", Severity.EMERGENCY, false);
        alert.setAcknowledged(true);
        when(alertService.acknowledge("ALT-4")).thenReturn(alert);

        mockMvc.perform(post("/api/v1/alerts/ALT-4/acknowledge"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.acknowledged").value(true));
    }

    @Test
    void resolve_success() throws Exception {
        Alert alert = TestDataFactory.createResolvedAlert("ALT-5", 1_717_000_000_000L);
        when(alertService.resolve("ALT-5")).thenReturn(alert);

        mockMvc.perform(post("/api/v1/alerts/ALT-5/resolve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resolved").value(true));
    }

    @Test
    void getDeliveries_listsChannelOutcomes() throws Exception {
        when(alertService.getDeliveries("ALT-1")).thenReturn(List.of(
                DeliveryRecord.builder().alertId("ALT-1").channel(DeliveryChannel.SMS).target("+15550100")
                        .status(DeliveryStatus.SUCCESS).attempts(1).completedAt(1717408800000L).build()));

        mockMvc.perform(get("/api/v1/alerts/ALT-1/deliveries"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].channel").value("SMS"))
                .andExpect(jsonPath("$[0].status").value("SUCCESS"))
                .andExpect(jsonPath("$[0].attempts").value(1));
    }
}
