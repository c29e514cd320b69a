package com.polkadot.analytics.model;

import java.util.Objects;

/**
 * Identifies one trained artifact: the entity and metric it was trained on, and the
 * variant (forecast model kind or anomaly method code).
 */
public record ModelKey(String entityId, String metric, String variant) {

    public ModelKey {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(variant, "variant");
        if (entityId.isBlank() || metric.isBlank() || variant.isBlank()) {
            throw new IllegalArgumentException("ModelKey components must not be blank");
        }
    }

    public static ModelKey forecast(String entityId, String metric, ModelKind kind) {
        return new ModelKey(entityId, metric, kind.getCode());
    }

    public static ModelKey anomaly(String entityId, String metric, AnomalyMethod method) {
        return new ModelKey(entityId, metric, method.getCode());
    }

    @Override
    public String toString() {
        return entityId + "/" + metric + "/" + variant;
    }
}
