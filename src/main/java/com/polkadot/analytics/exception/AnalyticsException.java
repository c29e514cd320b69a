package com.polkadot.analytics.exception;

import com.polkadot.analytics.model.ModelKey;

/**
 * Base type for failures raised by the analytics core. Carries the model key the
 * failure relates to when there is one.
 */
public class AnalyticsException extends RuntimeException {

    private final transient ModelKey modelKey;

    public AnalyticsException(String message) {
        this(message, null, null);
    }

    public AnalyticsException(String message, ModelKey modelKey) {
        this(message, modelKey, null);
    }

    public AnalyticsException(String message, ModelKey modelKey, Throwable cause) {
        super(message, cause);
        this.modelKey = modelKey;
    }

    public ModelKey getModelKey() {
        return modelKey;
    }
}
