package com.polkadot.analytics.model;

/**
 * Outcome of one retrain sweep over the known keys of a manager.
 */
public record RetrainSummary(int attempted, int succeeded, int failed, boolean cancelled) {

    public static RetrainSummary empty() {
        return new RetrainSummary(0, 0, 0, false);
    }
}
