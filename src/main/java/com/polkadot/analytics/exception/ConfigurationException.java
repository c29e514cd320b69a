package com.polkadot.analytics.exception;

/**
 * Invalid caller-supplied setting (fill method, sensitivity, horizon, model kind).
 * Raised before any computation starts.
 */
public class ConfigurationException extends AnalyticsException {

    public ConfigurationException(String message) {
        super(message);
    }
}
