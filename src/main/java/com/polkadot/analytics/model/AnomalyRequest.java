package com.polkadot.analytics.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Anomaly detection request")
public class AnomalyRequest {

    @Schema(description = "Parachain identifier", example = "2004", requiredMode = Schema.RequiredMode.REQUIRED)
    private String entityId;

    @Schema(description = "Metric name", example = "tvl", requiredMode = Schema.RequiredMode.REQUIRED)
    private String metric;

    @Schema(description = "Sensitivity in (0, 1); lower flags fewer points", example = "0.05")
    private Double sensitivity;

    @Schema(description = "Detection method: isolation_forest, statistical or zscore", example = "isolation_forest")
    private String method;

    @Schema(description = "Days of recent data to score", example = "7")
    private Integer lookbackDays;
}
