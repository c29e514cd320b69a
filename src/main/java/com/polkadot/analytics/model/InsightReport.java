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
@Schema(description = "Natural-language observations about parachain metrics")
public class InsightReport {

    @Schema(description = "Parachain identifier; absent for ecosystem-wide insights", example = "2004")
    private String entityId;

    @Schema(description = "Ordered insights (at most 10)",
            example = "[\"TVL has increased by 12.4% over the past 30 days, indicating growth momentum.\"]")
    private List<String> insights;

    @Schema(description = "One-paragraph summary of the insights")
    private String summary;

    @Schema(description = "Confidence of the rule-based inference", example = "0.85")
    private double confidence;

    @Schema(description = "Number of days (rows) analyzed", example = "30")
    private int dataPointsAnalyzed;

    @Schema(description = "Analysis window in days", example = "30")
    private int timeRangeDays;

    @Schema(description = "Whether the insights were rewritten by the enhancement hook", example = "false")
    private boolean aiEnhanced;

    @Schema(description = "True when at least one insight rule failed and its observations are missing",
            example = "false")
    private boolean partial;

    @Schema(description = "Categories of the insight rules that failed", example = "[]")
    private List<String> failedCategories;

    @Schema(description = "When the insights were generated")
    private Instant generatedAt;
}
