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
@Schema(description = "Forecast for a parachain metric over the requested horizon")
public class ForecastResult {

    @Schema(description = "Parachain identifier", example = "2004")
    private String entityId;

    @Schema(description = "Metric name", example = "tvl")
    private String metric;

    @Schema(description = "One predicted value per day of the horizon")
    private List<ForecastPoint> values;

    @Schema(description = "Overall confidence derived from the dispersion of the standardized future features", example = "0.82")
    private double confidence;

    @Schema(description = "Model kind used", example = "ensemble")
    private ModelKind modelKind;

    @Schema(description = "Mean absolute error on the training hold-out split", example = "10423.7")
    private double holdoutMae;

    @Schema(description = "Root mean squared error on the training hold-out split", example = "13981.2")
    private double holdoutRmse;

    @Schema(description = "When the forecast was generated")
    private Instant generatedAt;
}
