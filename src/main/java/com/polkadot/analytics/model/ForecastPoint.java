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
@Schema(description = "Predicted value for one future day")
public class ForecastPoint {

    @Schema(description = "Future instant the prediction applies to", example = "2026-10-20T09:30:00Z")
    private Instant timestamp;

    @Schema(description = "Predicted metric value", example = "1254321.5")
    private double predictedValue;

    @Schema(description = "Confidence score (0.1-0.95)", example = "0.82")
    private double confidence;
}
