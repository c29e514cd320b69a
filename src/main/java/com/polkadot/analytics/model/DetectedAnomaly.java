package com.polkadot.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
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
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "A point flagged as anomalous")
public class DetectedAnomaly {

    @Schema(description = "Observation time", example = "2026-10-18T00:00:00Z")
    private Instant timestamp;

    @Schema(description = "Observed value", example = "2000000.0")
    private double value;

    @Schema(description = "Isolation forest decision score (negative = outlier); set for isolation_forest", example = "-0.08")
    private Double anomalyScore;

    @Schema(description = "Absolute z-score against the baseline; set for statistical", example = "4.7")
    @JsonProperty("zScore")
    private Double zScore;

    @Schema(description = "Severity", example = "high", allowableValues = {"medium", "high"})
    private Severity severity;

    @Schema(description = "Human-readable description", example = "Statistical anomaly detected (z-score: 4.70)")
    private String description;
}
