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
@Schema(description = "Forecast request")
public class ForecastRequest {

    @Schema(description = "Parachain identifier", example = "2004", requiredMode = Schema.RequiredMode.REQUIRED)
    private String entityId;

    @Schema(description = "Metric name", example = "tvl", requiredMode = Schema.RequiredMode.REQUIRED)
    private String metric;

    @Schema(description = "Number of days to predict", example = "7")
    private Integer days;

    @Schema(description = "Model kind: linear, rf, gbm or ensemble", example = "ensemble")
    private String modelKind;
}
