package com.polkadot.analytics.engine.anomaly;

import com.polkadot.analytics.model.AnomalyBaseline;
import com.polkadot.analytics.model.AnomalyMethod;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BaselineStatisticsTest {

    @Test
    void compute_populationStdAndInterpolatedQuartiles() {
        AnomalyBaseline baseline = BaselineStatistics.compute(new double[]{1, 2, 3, 4}, AnomalyMethod.STATISTICAL);

        assertThat(baseline.getMean()).isEqualTo(2.5);
        assertThat(baseline.getStd()).isCloseTo(Math.sqrt(1.25), within(1e-12));
        assertThat(baseline.getMedian()).isEqualTo(2.5);
        assertThat(baseline.getQ25()).isCloseTo(1.75, within(1e-12));
        assertThat(baseline.getQ75()).isCloseTo(3.25, within(1e-12));
        assertThat(baseline.getMethod()).isEqualTo(AnomalyMethod.STATISTICAL);
    }

    @Test
    void zScore_isAbsoluteAndZeroWithoutSpread() {
        AnomalyBaseline baseline = BaselineStatistics.compute(new double[]{90, 110}, AnomalyMethod.STATISTICAL);
        assertThat(BaselineStatistics.zScore(70, baseline)).isCloseTo(3.0, within(1e-12));

        AnomalyBaseline flat = BaselineStatistics.compute(new double[]{5, 5, 5}, AnomalyMethod.STATISTICAL);
        assertThat(BaselineStatistics.zScore(500, flat)).isZero();
    }

    @Test
    void compute_rejectsEmptyInput() {
        assertThatThrownBy(() -> BaselineStatistics.compute(new double[0], AnomalyMethod.STATISTICAL))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
