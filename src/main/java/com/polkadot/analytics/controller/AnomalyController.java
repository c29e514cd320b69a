package com.polkadot.analytics.controller;

import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.exception.ServiceUnavailableException;
import com.polkadot.analytics.model.AnomalyReport;
import com.polkadot.analytics.model.AnomalyRequest;
import com.polkadot.analytics.service.AnomalyDetectionService;
import com.polkadot.analytics.service.AnomalyModelManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Anomaly detection over recent metric windows")
public class AnomalyController {

    private final AnomalyDetectionService detectionService;
    private final ObjectProvider<AnomalyModelManager> anomalyManager;
    private final AnalyticsConfig config;

    public AnomalyController(AnomalyDetectionService detectionService,
                             ObjectProvider<AnomalyModelManager> anomalyManager,
                             AnalyticsConfig config) {
        this.detectionService = detectionService;
        this.anomalyManager = anomalyManager;
        this.config = config;
    }

    @PostMapping("/detect")
    @Operation(summary = "Detect anomalies",
               description = "Scores the last lookbackDays of stored data against the trained baseline. " +
                       "isolation_forest flags points with a negative decision value; statistical flags points whose " +
                       "z-score exceeds the two-sided normal quantile for the sensitivity.")
    public ResponseEntity<AnomalyReport> detect(@RequestBody AnomalyRequest request) {
        return ResponseEntity.ok(detectionService.detect(request));
    }

    @GetMapping("/methods")
    @Operation(summary = "List detection methods",
               description = "Supported method codes and the default method. zscore is accepted as an alias of statistical.")
    public ResponseEntity<Map<String, Object>> methods() {
        AnomalyModelManager manager = anomalyManager.getIfAvailable();
        if (manager == null) {
            throw new ServiceUnavailableException("Anomaly detection");
        }
        return ResponseEntity.ok(Map.of(
                "methods", manager.methods(),
                "defaultMethod", config.getAnomaly().getDefaultMethod(),
                "defaultSensitivity", config.getAnomaly().getDefaultSensitivity()));
    }
}
