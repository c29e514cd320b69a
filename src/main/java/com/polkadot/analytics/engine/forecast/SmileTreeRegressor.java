package com.polkadot.analytics.engine.forecast;

import com.polkadot.analytics.model.FeatureTable;
import smile.base.cart.Loss;
import smile.data.DataFrame;
import smile.data.formula.Formula;
import smile.math.MathEx;
import smile.regression.DataFrameRegression;
import smile.regression.GradientTreeBoost;
import smile.regression.RandomForest;

import java.util.Arrays;

/**
 * Tree ensemble regressors backed by Smile. Both models are {@link java.io.Serializable}
 * and travel inside the forecast artifact.
 */
public class SmileTreeRegressor implements Regressor {

    private static final long serialVersionUID = 1L;

    private static final Formula FORMULA = Formula.lhs(FeatureTable.VALUE_COLUMN);
    private static final String[] COLUMNS = columns();

    private final DataFrameRegression model;

    private SmileTreeRegressor(DataFrameRegression model) {
        this.model = model;
    }

    public static SmileTreeRegressor randomForest(double[][] x, double[] y, int numTrees, long seed) {
        MathEx.setSeed(seed);
        int mtry = Math.max(1, x[0].length / 3);
        RandomForest forest = RandomForest.fit(FORMULA, frame(x, y),
                numTrees, mtry, 20, Math.max(5, x.length / 5), 5, 1.0);
        return new SmileTreeRegressor(forest);
    }

    public static SmileTreeRegressor gradientBoosting(double[][] x, double[] y, int numTrees, long seed) {
        MathEx.setSeed(seed);
        GradientTreeBoost boost = GradientTreeBoost.fit(FORMULA, frame(x, y), Loss.ls(),
                numTrees, 20, 6, 5, 0.1, 0.7);
        return new SmileTreeRegressor(boost);
    }

    @Override
    public double[] predict(double[][] features) {
        // the target column is required by the frame schema but ignored by predict
        DataFrame frame = frame(features, new double[features.length]);
        double[] out = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            out[i] = model.predict(frame.get(i));
        }
        return out;
    }

    private static DataFrame frame(double[][] x, double[] y) {
        double[][] data = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            data[i] = Arrays.copyOf(x[i], x[i].length + 1);
            data[i][x[i].length] = y[i];
        }
        return DataFrame.of(data, COLUMNS);
    }

    private static String[] columns() {
        String[] names = Arrays.copyOf(FeatureTable.FEATURE_NAMES, FeatureTable.FEATURE_COUNT + 1);
        names[FeatureTable.FEATURE_COUNT] = FeatureTable.VALUE_COLUMN;
        return names;
    }
}
