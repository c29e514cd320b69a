package com.polkadot.analytics.engine.anomaly;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.polkadot.analytics.engine.features.FeatureScaler;
import com.polkadot.analytics.engine.isolationforest.IsolationForest;
import com.polkadot.analytics.model.AnomalyBaseline;
import com.polkadot.analytics.model.AnomalyMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted state of one anomaly key. The forest is only present for
 * {@link AnomalyMethod#ISOLATION_FOREST}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnomalyArtifact {

    private AnomalyMethod method;
    private AnomalyBaseline baseline;
    private FeatureScaler scaler;
    private IsolationForest forest;
    private int trainingSamples;
    private long trainedAtEpochMs;

    @JsonIgnore
    public boolean hasForest() {
        return forest != null;
    }
}
