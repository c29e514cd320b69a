package com.polkadot.analytics.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of training an anomaly baseline (and model)")
public class AnomalyTrainingReport {

    @Schema(description = "Parachain identifier", example = "2004")
    private String entityId;

    @Schema(description = "Metric name", example = "tvl")
    private String metric;

    @Schema(description = "Detection method trained", example = "isolation_forest")
    private AnomalyMethod method;

    @Schema(description = "Rows used for training", example = "335")
    private int trainingSamples;

    @Schema(description = "Baseline mean", example = "1000000.0")
    private double baselineMean;

    @Schema(description = "Baseline population standard deviation", example = "85000.0")
    private double baselineStd;

    @Schema(description = "Number of model input features", example = "12")
    private int featureCount;

    @Schema(description = "Training completion time")
    private Instant trainedAt;
}
