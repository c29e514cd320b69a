package com.polkadot.analytics.engine.anomaly;

import com.polkadot.analytics.model.AnomalyBaseline;
import com.polkadot.analytics.model.AnomalyMethod;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Summary statistics of training values: population standard deviation and
 * linearly interpolated percentiles.
 */
public final class BaselineStatistics {

    private BaselineStatistics() {}

    public static AnomalyBaseline compute(double[] values, AnomalyMethod method) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot compute a baseline from no values");
        }
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(values);
        return AnomalyBaseline.builder()
                .mean(new Mean().evaluate(values))
                .std(new StandardDeviation(false).evaluate(values))
                .median(percentile.evaluate(50))
                .q25(percentile.evaluate(25))
                .q75(percentile.evaluate(75))
                .method(method)
                .build();
    }

    /**
     * Absolute z-score against the baseline; 0 when the baseline has no spread.
     */
    public static double zScore(double value, AnomalyBaseline baseline) {
        if (baseline.getStd() == 0.0) {
            return 0.0;
        }
        return Math.abs(value - baseline.getMean()) / baseline.getStd();
    }
}
