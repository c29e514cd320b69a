package com.polkadot.analytics.engine.features;

import com.polkadot.analytics.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Strategy for filling gaps ({@code NaN}) in the value column before features are derived.
 */
public enum FillMethod {

    FORWARD("forward") {
        @Override
        public double[] fill(double[] values) {
            double[] filled = Arrays.copyOf(values, values.length);
            double last = Double.NaN;
            for (int i = 0; i < filled.length; i++) {
                if (Double.isNaN(filled[i])) {
                    filled[i] = last;
                } else {
                    last = filled[i];
                }
            }
            return filled;
        }
    },

    BACKWARD("backward") {
        @Override
        public double[] fill(double[] values) {
            double[] filled = Arrays.copyOf(values, values.length);
            double next = Double.NaN;
            for (int i = filled.length - 1; i >= 0; i--) {
                if (Double.isNaN(filled[i])) {
                    filled[i] = next;
                } else {
                    next = filled[i];
                }
            }
            return filled;
        }
    },

    /**
     * Linear interpolation by position between the nearest defined neighbours.
     * Leading gaps stay undefined; trailing gaps carry the last defined value.
     */
    INTERPOLATE("interpolate") {
        @Override
        public double[] fill(double[] values) {
            double[] filled = Arrays.copyOf(values, values.length);
            int previous = -1;
            for (int i = 0; i < filled.length; i++) {
                if (Double.isNaN(filled[i])) {
                    continue;
                }
                if (previous >= 0 && i - previous > 1) {
                    double step = (filled[i] - filled[previous]) / (i - previous);
                    for (int j = previous + 1; j < i; j++) {
                        filled[j] = filled[previous] + step * (j - previous);
                    }
                }
                previous = i;
            }
            if (previous >= 0) {
                for (int j = previous + 1; j < filled.length; j++) {
                    filled[j] = filled[previous];
                }
            }
            return filled;
        }
    };

    private final String code;

    FillMethod(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Returns a filled copy; the input array is left untouched.
     */
    public abstract double[] fill(double[] values);

    public static FillMethod fromCode(String code) {
        if (code == null) {
            throw new ConfigurationException("Fill method must not be null");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(method -> method.code.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("Invalid fill method: " + code
                        + " (expected forward, backward or interpolate)"));
    }
}
