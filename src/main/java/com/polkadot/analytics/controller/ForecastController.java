package com.polkadot.analytics.controller;

import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.exception.ConfigurationException;
import com.polkadot.analytics.exception.ServiceUnavailableException;
import com.polkadot.analytics.model.ForecastRequest;
import com.polkadot.analytics.model.ForecastResult;
import com.polkadot.analytics.model.ModelKind;
import com.polkadot.analytics.service.ForecastModelManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/forecasts")
@Tag(name = "Forecasts", description = "Metric forecasts from trained models")
public class ForecastController {

    private final ObjectProvider<ForecastModelManager> forecastManager;
    private final AnalyticsConfig config;

    public ForecastController(ObjectProvider<ForecastModelManager> forecastManager, AnalyticsConfig config) {
        this.forecastManager = forecastManager;
        this.config = config;
    }

    @PostMapping
    @Operation(summary = "Forecast a parachain metric",
               description = "Predicts one value per day for the requested horizon using a previously trained model. " +
                       "Returns 404 when no model of that kind was trained for the parachain and metric.")
    public ResponseEntity<ForecastResult> forecast(@RequestBody ForecastRequest request) {
        ForecastModelManager manager = forecastManager.getIfAvailable();
        if (manager == null) {
            throw new ServiceUnavailableException("Forecasting");
        }
        if (request.getEntityId() == null || request.getEntityId().isBlank()
                || request.getMetric() == null || request.getMetric().isBlank()) {
            throw new ConfigurationException("entityId and metric are required");
        }
        int days = request.getDays() != null ? request.getDays() : config.getForecast().getDefaultHorizonDays();
        ModelKind kind = ModelKind.fromCode(
                request.getModelKind() != null ? request.getModelKind() : config.getForecast().getDefaultModelKind());

        return ResponseEntity.ok(manager.predict(request.getEntityId(), request.getMetric(), days, kind));
    }
}
