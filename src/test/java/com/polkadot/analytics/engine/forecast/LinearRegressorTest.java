package com.polkadot.analytics.engine.forecast;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LinearRegressorTest {

    @Test
    void fit_recoversExactLinearRelation() {
        double[][] x = new double[20][2];
        double[] y = new double[20];
        for (int i = 0; i < 20; i++) {
            x[i][0] = i;
            x[i][1] = (i * 7) % 5;
            y[i] = 3.0 + 2.0 * x[i][0] - 0.5 * x[i][1];
        }
        LinearRegressor model = LinearRegressor.fit(x, y);

        assertThat(model.getIntercept()).isCloseTo(3.0, within(1e-8));
        assertThat(model.getCoefficients()[0]).isCloseTo(2.0, within(1e-8));
        assertThat(model.getCoefficients()[1]).isCloseTo(-0.5, within(1e-8));
        assertThat(model.predict(new double[]{100, 1})).isCloseTo(202.5, within(1e-6));
    }

    @Test
    void fit_constantAndDuplicateColumnsStillSolve() {
        double[][] x = new double[10][3];
        double[] y = new double[10];
        for (int i = 0; i < 10; i++) {
            x[i][0] = 0.0;
            x[i][1] = i;
            x[i][2] = i;
            y[i] = 1.0 + 4.0 * i;
        }
        LinearRegressor model = LinearRegressor.fit(x, y);

        double[] predictions = model.predict(x);
        for (int i = 0; i < 10; i++) {
            assertThat(predictions[i]).isCloseTo(y[i], within(1e-6));
        }
        // minimum-norm solution splits weight evenly across identical columns
        assertThat(model.getCoefficients()[1]).isCloseTo(model.getCoefficients()[2], within(1e-8));
    }

    @Test
    void fit_ignoresRoundingNoiseDirections() {
        // lag-like columns of an exact line are collinear with the intercept
        double[][] x = new double[60][3];
        double[] y = new double[60];
        for (int i = 0; i < 60; i++) {
            double t = 0.1 * i;
            x[i][0] = t - 0.1;
            x[i][1] = t - 0.7;
            x[i][2] = t - 3.0;
            y[i] = 2.0 * t + 5.0;
        }
        LinearRegressor model = LinearRegressor.fit(x, y);

        // one step beyond the training range stays on the line
        double t = 6.0;
        assertThat(model.predict(new double[]{t - 0.1, t - 0.7, t - 3.0})).isCloseTo(17.0, within(1e-6));
        for (double coefficient : model.getCoefficients()) {
            assertThat(Math.abs(coefficient)).isLessThan(10.0);
        }
    }
}
