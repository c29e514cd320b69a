package com.polkadot.analytics.engine.forecast;

import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.model.ModelKind;
import org.springframework.stereotype.Component;

/**
 * Fits the regressor for a {@link ModelKind}. {@code ensemble} is served by gradient boosting.
 */
@Component
public class RegressorFactory {

    private final AnalyticsConfig config;

    public RegressorFactory(AnalyticsConfig config) {
        this.config = config;
    }

    public Regressor fit(ModelKind kind, double[][] x, double[] y) {
        AnalyticsConfig.Forecast forecast = config.getForecast();
        switch (kind) {
            case LINEAR:
                return LinearRegressor.fit(x, y);
            case RANDOM_FOREST:
                return SmileTreeRegressor.randomForest(x, y, forecast.getNumTrees(), forecast.getSeed());
            case GRADIENT_BOOSTED:
            case ENSEMBLE:
                return SmileTreeRegressor.gradientBoosting(x, y, forecast.getNumTrees(), forecast.getSeed());
            default:
                throw new IllegalArgumentException("Unsupported model kind: " + kind);
        }
    }
}
