package com.polkadot.analytics.exception;

import com.polkadot.analytics.model.ModelKey;

/**
 * No trained artifact exists for the key, neither in memory nor in the model cache.
 */
public class ModelUnavailableException extends AnalyticsException {

    public ModelUnavailableException(ModelKey modelKey) {
        super("Model not available for " + modelKey + "; train it first", modelKey);
    }
}
