package com.polkadot.analytics.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Summary statistics of the metric values seen at training time")
public class AnomalyBaseline implements Serializable {

    private static final long serialVersionUID = 1L;

    @Schema(description = "Mean value", example = "1000000.0")
    private double mean;

    @Schema(description = "Population standard deviation", example = "85000.0")
    private double std;

    @Schema(description = "Median value", example = "998500.0")
    private double median;

    @Schema(description = "25th percentile", example = "940000.0")
    private double q25;

    @Schema(description = "75th percentile", example = "1060000.0")
    private double q75;

    @Schema(description = "Detection method the baseline was trained for", example = "statistical")
    private AnomalyMethod method;
}
