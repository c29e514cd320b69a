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
@Schema(description = "Hold-out evaluation of a freshly trained forecast model")
public class ForecastTrainingReport {

    @Schema(description = "Parachain identifier", example = "2004")
    private String entityId;

    @Schema(description = "Metric name", example = "tvl")
    private String metric;

    @Schema(description = "Model kind trained", example = "gbm")
    private ModelKind modelKind;

    @Schema(description = "Mean absolute error on the hold-out split", example = "10423.7")
    private double mae;

    @Schema(description = "Root mean squared error on the hold-out split", example = "13981.2")
    private double rmse;

    @Schema(description = "Rows used for fitting (first 80%)", example = "268")
    private int trainingSamples;

    @Schema(description = "Rows used for evaluation (last 20%)", example = "67")
    private int testSamples;

    @Schema(description = "Number of model input features", example = "12")
    private int featureCount;

    @Schema(description = "Training completion time")
    private Instant trainedAt;
}
