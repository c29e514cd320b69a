package com.polkadot.analytics.exception;

import com.polkadot.analytics.model.ModelKey;

/**
 * Unexpected failure inside a fit, transform, predict or persistence step.
 */
public class ComputationException extends AnalyticsException {

    public ComputationException(String message, ModelKey modelKey, Throwable cause) {
        super(message + " [" + modelKey + "]: " + (cause != null ? cause.getMessage() : "unknown cause"),
                modelKey, cause);
    }
}
