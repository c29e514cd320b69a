package com.polkadot.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.polkadot.analytics.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Regression strategy used by a forecast model. {@code ensemble} is served by
 * gradient boosting.
 */
public enum ModelKind {
    LINEAR("linear"),
    RANDOM_FOREST("rf"),
    GRADIENT_BOOSTED("gbm"),
    ENSEMBLE("ensemble");

    private final String code;

    ModelKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ModelKind fromCode(String code) {
        if (code == null) {
            throw new ConfigurationException("Model kind must not be null");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.code.equals(normalized) || kind.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("Unknown model kind: " + code
                        + " (expected one of linear, rf, gbm, ensemble)"));
    }
}
