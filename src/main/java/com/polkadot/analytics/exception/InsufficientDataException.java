package com.polkadot.analytics.exception;

import com.polkadot.analytics.model.ModelKey;

public class InsufficientDataException extends AnalyticsException {

    private final int available;
    private final int required;

    public InsufficientDataException(ModelKey modelKey, int available, int required) {
        super(String.format("Insufficient data for %s: %d rows available, %d required",
                modelKey, available, required), modelKey);
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
