package com.polkadot.analytics.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of scoring a recent window against a trained anomaly baseline")
public class AnomalyReport {

    @Schema(description = "Parachain identifier", example = "2004")
    private String entityId;

    @Schema(description = "Metric name", example = "tvl")
    private String metric;

    @Schema(description = "Flagged points in timestamp order")
    private List<DetectedAnomaly> anomalies;

    @Schema(description = "Number of points scanned", example = "168")
    private int totalPoints;

    @Schema(description = "Number of flagged points", example = "3")
    private int anomalyCount;

    @Schema(description = "Flagged points as a percentage of points scanned", example = "1.79")
    private double anomalyPercentage;

    @Schema(description = "Detection method", example = "statistical")
    private AnomalyMethod method;

    @Schema(description = "Sensitivity used (0-1, lower = fewer flags)", example = "0.05")
    private double sensitivity;

    @Schema(description = "Baseline the window was compared against")
    private AnomalyBaseline baseline;

    @Schema(description = "When the detection ran")
    private Instant generatedAt;
}
