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
@Schema(description = "Request to train a model from stored history")
public class TrainRequest {

    @Schema(description = "Parachain identifier", example = "2004", requiredMode = Schema.RequiredMode.REQUIRED)
    private String entityId;

    @Schema(description = "Metric name", example = "tvl", requiredMode = Schema.RequiredMode.REQUIRED)
    private String metric;

    @Schema(description = "Forecast model kind (linear, rf, gbm, ensemble) or anomaly method (isolation_forest, statistical)",
            example = "ensemble")
    private String variant;

    @Schema(description = "Days of history to fetch", example = "365")
    private Integer historyDays;

    @Schema(description = "Gap-fill method: forward, backward or interpolate", example = "forward")
    private String fillMethod;
}
