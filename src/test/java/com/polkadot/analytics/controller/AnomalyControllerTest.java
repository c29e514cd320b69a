package com.polkadot.analytics.controller;

import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.exception.ConfigurationException;
import com.polkadot.analytics.exception.ModelUnavailableException;
import com.polkadot.analytics.model.AnomalyMethod;
import com.polkadot.analytics.model.AnomalyReport;
import com.polkadot.analytics.model.AnomalyRequest;
import com.polkadot.analytics.model.DetectedAnomaly;
import com.polkadot.analytics.model.ModelKey;
import com.polkadot.analytics.model.Severity;
import com.polkadot.analytics.service.AnomalyDetectionService;
import com.polkadot.analytics.service.AnomalyModelManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnomalyController.class)
@Import(AnalyticsConfig.class)
class AnomalyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnomalyDetectionService detectionService;

    @MockBean
    private AnomalyModelManager anomalyManager;

    @Test
    void detect_returnsReport() throws Exception {
        when(detectionService.detect(any(AnomalyRequest.class))).thenReturn(AnomalyReport.builder()
                .entityId("2004")
                .metric("tvl")
                .method(AnomalyMethod.STATISTICAL)
                .sensitivity(0.05)
                .totalPoints(7)
                .anomalyCount(1)
                .anomalyPercentage(100.0 / 7)
                .anomalies(List.of(DetectedAnomaly.builder()
                        .timestamp(Instant.parse("2024-06-01T00:00:00Z"))
                        .value(200)
                        .zScore(10.0)
                        .severity(Severity.HIGH)
                        .description("Statistical anomaly detected (z-score: 10.00)")
                        .build()))
                .build());

        mockMvc.perform(post("/api/v1/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entityId\":\"2004\",\"metric\":\"tvl\",\"method\":\"statistical\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.method").value("statistical"))
                .andExpect(jsonPath("$.anomalyCount").value(1))
                .andExpect(jsonPath("$.anomalies[0].zScore").value(10.0))
                .andExpect(jsonPath("$.anomalies[0].severity").value("high"))
                .andExpect(jsonPath("$.anomalies[0].anomalyScore").doesNotExist());
    }

    @Test
    void detect_invalidSensitivity_returns400() throws Exception {
        when(detectionService.detect(any(AnomalyRequest.class)))
                .thenThrow(new ConfigurationException("Sensitivity must be between 0 and 1 (exclusive), got 1.5"));

        mockMvc.perform(post("/api/v1/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entityId\":\"2004\",\"metric\":\"tvl\",\"sensitivity\":1.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Sensitivity must be between 0 and 1 (exclusive), got 1.5"));
    }

    @Test
    void detect_untrainedBaseline_returns404() throws Exception {
        when(detectionService.detect(any(AnomalyRequest.class)))
                .thenThrow(new ModelUnavailableException(
                        ModelKey.anomaly("2004", "tvl", AnomalyMethod.ISOLATION_FOREST)));

        mockMvc.perform(post("/api/v1/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entityId\":\"2004\",\"metric\":\"tvl\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void methods_listsCodesAndDefaults() throws Exception {
        when(anomalyManager.methods()).thenReturn(List.of("isolation_forest", "statistical"));

        mockMvc.perform(get("/api/v1/anomalies/methods"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.methods[0]").value("isolation_forest"))
                .andExpect(jsonPath("$.defaultMethod").value("isolation_forest"))
                .andExpect(jsonPath("$.defaultSensitivity").value(0.05));
    }
}
