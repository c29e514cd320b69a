package com.polkadot.analytics.engine.forecast;

import java.io.Serializable;

/**
 * A fitted regression model over standardized feature rows. Implementations are
 * persisted with Java serialization as part of a forecast artifact.
 */
public interface Regressor extends Serializable {

    double[] predict(double[][] features);

    default double predict(double[] features) {
        return predict(new double[][]{features})[0];
    }
}
