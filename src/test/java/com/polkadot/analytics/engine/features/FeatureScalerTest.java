package com.polkadot.analytics.engine.features;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FeatureScalerTest {

    @Test
    void fit_usesPopulationStdAndUnitScaleForConstantColumns() {
        double[][] data = {{1, 5}, {3, 5}};
        FeatureScaler scaler = FeatureScaler.fit(data);

        assertThat(scaler.getMean()).containsExactly(2, 5);
        assertThat(scaler.getScale()).containsExactly(1, 1);
        assertThat(scaler.transform(new double[]{3, 5})).containsExactly(1, 0);
    }

    @Test
    void fit_treatsRoundingNoiseAsConstant() {
        double base = 2.160246899469287;
        double[][] data = {{base}, {base + 4e-16}, {base - 4e-16}, {base}};
        FeatureScaler scaler = FeatureScaler.fit(data);

        assertThat(scaler.getScale()).containsExactly(1.0);
        assertThat(scaler.transform(new double[]{base + 0.5})[0]).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void transform_standardizesTrainingColumns() {
        double[][] data = {{10}, {20}, {30}, {40}};
        FeatureScaler scaler = FeatureScaler.fit(data);
        double[][] scaled = scaler.transform(data);

        double sum = 0;
        double squares = 0;
        for (double[] row : scaled) {
            sum += row[0];
            squares += row[0] * row[0];
        }
        assertThat(sum).isCloseTo(0.0, within(1e-12));
        assertThat(squares / scaled.length).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void transform_rejectsWrongWidth() {
        FeatureScaler scaler = FeatureScaler.fit(new double[][]{{1, 2}});
        assertThatThrownBy(() -> scaler.transform(new double[]{1})).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void survivesJsonRoundTrip() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        FeatureScaler scaler = FeatureScaler.fit(new double[][]{{1, 10}, {2, 30}, {6, 20}});

        FeatureScaler restored = mapper.readValue(mapper.writeValueAsString(scaler), FeatureScaler.class);

        assertThat(restored.transform(new double[]{4, 15})).containsExactly(scaler.transform(new double[]{4, 15}));
    }
}
