package com.polkadot.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.polkadot.analytics.exception.ConfigurationException;

import java.util.Locale;

public enum AnomalyMethod {
    ISOLATION_FOREST("isolation_forest"),
    STATISTICAL("statistical");

    private final String code;

    AnomalyMethod(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Parses a method code. {@code zscore} is accepted as an alias of {@code statistical}.
     */
    @JsonCreator
    public static AnomalyMethod fromCode(String code) {
        if (code == null) {
            throw new ConfigurationException("Anomaly method must not be null");
        }
        switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "isolation_forest":
                return ISOLATION_FOREST;
            case "statistical":
            case "zscore":
                return STATISTICAL;
            default:
                throw new ConfigurationException("Unknown anomaly method: " + code
                        + " (expected isolation_forest, statistical or zscore)");
        }
    }
}
