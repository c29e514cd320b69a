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
@Schema(description = "Insight generation request")
public class InsightsRequest {

    @Schema(description = "Parachain identifier; omit for ecosystem-wide insights", example = "2004")
    private String entityId;

    @Schema(description = "Days of history to analyze", example = "30")
    private Integer timeRangeDays;

    @Schema(description = "Append forecast outlook insights when models are trained (default true)", example = "true")
    private Boolean includePredictions;
}
