package com.polkadot.analytics.controller;

import com.polkadot.analytics.exception.ServiceUnavailableException;
import com.polkadot.analytics.model.AnomalyTrainingReport;
import com.polkadot.analytics.model.ForecastTrainingReport;
import com.polkadot.analytics.model.ModelStatus;
import com.polkadot.analytics.model.RetrainSummary;
import com.polkadot.analytics.model.TrainRequest;
import com.polkadot.analytics.service.AnomalyModelManager;
import com.polkadot.analytics.service.ForecastModelManager;
import com.polkadot.analytics.service.ModelTrainingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Model training, retraining and status")
public class ModelController {

    private final ModelTrainingService trainingService;
    private final ObjectProvider<ForecastModelManager> forecastManager;
    private final ObjectProvider<AnomalyModelManager> anomalyManager;

    public ModelController(ModelTrainingService trainingService,
                           ObjectProvider<ForecastModelManager> forecastManager,
                           ObjectProvider<AnomalyModelManager> anomalyManager) {
        this.trainingService = trainingService;
        this.forecastManager = forecastManager;
        this.anomalyManager = anomalyManager;
    }

    @GetMapping("/status")
    @Operation(summary = "Model readiness",
               description = "Whether each manager has at least one trained or loaded model. " +
                       "A disabled manager reports false.")
    public ResponseEntity<ModelStatus> status() {
        ForecastModelManager forecasts = forecastManager.getIfAvailable();
        AnomalyModelManager anomalies = anomalyManager.getIfAvailable();
        return ResponseEntity.ok(new ModelStatus(
                forecasts != null && forecasts.isReady(),
                anomalies != null && anomalies.isReady()));
    }

    @PostMapping("/forecast/train")
    @Operation(summary = "Train a forecast model",
               description = "Fetches historyDays of stored data, derives features and fits the requested model kind " +
                       "(linear, rf, gbm, ensemble) on the first 80% of rows. Reports hold-out MAE and RMSE. " +
                       "Returns 422 when fewer than 30 feature rows are available.")
    public ResponseEntity<ForecastTrainingReport> trainForecast(@RequestBody TrainRequest request) {
        return ResponseEntity.ok(trainingService.trainForecast(request));
    }

    @PostMapping("/anomaly/train")
    @Operation(summary = "Train an anomaly baseline",
               description = "Fetches historyDays of stored data and computes the baseline statistics. " +
                       "For isolation_forest also fits a forest calibrated to 10% training contamination. " +
                       "Returns 422 when fewer than 50 feature rows are available.")
    public ResponseEntity<AnomalyTrainingReport> trainAnomaly(@RequestBody TrainRequest request) {
        return ResponseEntity.ok(trainingService.trainAnomaly(request));
    }

    @GetMapping("/forecast/{entityId}/{metric}")
    @Operation(summary = "Forecast model info",
               description = "Per model kind: loaded (in memory), available (persisted only) or not_trained.")
    public ResponseEntity<Map<String, String>> forecastInfo(
            @Parameter(description = "Parachain identifier", example = "2004")
            @PathVariable String entityId,
            @Parameter(description = "Metric name", example = "tvl")
            @PathVariable String metric) {
        ForecastModelManager manager = forecastManager.getIfAvailable();
        if (manager == null) {
            throw new ServiceUnavailableException("Forecasting");
        }
        return ResponseEntity.ok(manager.describe(entityId, metric));
    }

    @PostMapping("/retrain")
    @Operation(summary = "Retrain all known models",
               description = "Re-trains every persisted or cached key from fresh history. Failures are counted, " +
                       "not fatal. Returns 409 when a sweep is already running.")
    public ResponseEntity<?> retrain() {
        Optional<Map<String, RetrainSummary>> summaries = trainingService.retrainAll();
        if (summaries.isEmpty()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "Retrain sweep already running"));
        }
        return ResponseEntity.ok(summaries.get());
    }

    @PostMapping("/retrain/cancel")
    @Operation(summary = "Cancel the running retrain sweep",
               description = "Keys already retrained keep their new models; the sweep stops before the next key.")
    public ResponseEntity<Map<String, Object>> cancelRetrain() {
        boolean cancelled = trainingService.cancelRetrain();
        return ResponseEntity.ok(Map.of("cancelRequested", cancelled));
    }
}
