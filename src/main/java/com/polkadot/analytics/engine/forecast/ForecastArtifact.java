package com.polkadot.analytics.engine.forecast;

import com.polkadot.analytics.engine.features.FeatureScaler;
import com.polkadot.analytics.model.ModelKind;

import java.io.Serializable;
import java.time.Instant;

/**
 * Everything needed to forecast one key without the training data: the fitted
 * regressor, its scaler and the tail of the observed series that seeds the lags.
 */
public class ForecastArtifact implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ModelKind modelKind;
    private final Regressor regressor;
    private final FeatureScaler scaler;
    private final double[] recentValues;
    private final double holdoutMae;
    private final double holdoutRmse;
    private final int trainingSamples;
    private final int testSamples;
    private final Instant trainedAt;

    public ForecastArtifact(ModelKind modelKind, Regressor regressor, FeatureScaler scaler, double[] recentValues,
                            double holdoutMae, double holdoutRmse, int trainingSamples, int testSamples,
                            Instant trainedAt) {
        this.modelKind = modelKind;
        this.regressor = regressor;
        this.scaler = scaler;
        this.recentValues = recentValues.clone();
        this.holdoutMae = holdoutMae;
        this.holdoutRmse = holdoutRmse;
        this.trainingSamples = trainingSamples;
        this.testSamples = testSamples;
        this.trainedAt = trainedAt;
    }

    public ModelKind getModelKind() { return modelKind; }
    public Regressor getRegressor() { return regressor; }
    public FeatureScaler getScaler() { return scaler; }
    public double[] getRecentValues() { return recentValues.clone(); }
    public double getHoldoutMae() { return holdoutMae; }
    public double getHoldoutRmse() { return holdoutRmse; }
    public int getTrainingSamples() { return trainingSamples; }
    public int getTestSamples() { return testSamples; }
    public Instant getTrainedAt() { return trainedAt; }
}
