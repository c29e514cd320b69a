package com.polkadot.analytics.controller;

import com.polkadot.analytics.model.InsightReport;
import com.polkadot.analytics.model.InsightsRequest;
import com.polkadot.analytics.service.InsightService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/insights")
@Tag(name = "Insights", description = "Rule-based natural-language observations")
public class InsightController {

    private final InsightService insightService;

    public InsightController(InsightService insightService) {
        this.insightService = insightService;
    }

    @PostMapping
    @Operation(summary = "Generate insights",
               description = "Analyzes daily TVL, transaction and user series for one parachain, or their sum across " +
                       "all parachains when entityId is omitted. Emits trend, volatility, weekly pattern and health " +
                       "observations, plus forecast outlook sentences when includePredictions is set.")
    public ResponseEntity<InsightReport> generate(@RequestBody(required = false) InsightsRequest request) {
        return ResponseEntity.ok(insightService.generate(request != null ? request : new InsightsRequest()));
    }
}
