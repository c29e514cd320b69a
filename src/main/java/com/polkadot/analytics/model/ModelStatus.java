package com.polkadot.analytics.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Readiness of the model managers")
public record ModelStatus(
        @Schema(description = "True once a forecast model was trained or loaded", example = "true")
        boolean forecasterReady,
        @Schema(description = "True once an anomaly baseline was trained or loaded", example = "false")
        boolean anomalyDetectorReady) {}
