package org.processverify.engine.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Weights of the composite Jaccard score. They are expected to sum to 1.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimilaritySettings {
    public double sequenceFlowWeight = 0.7;
    public double messageFlowWeight = 0.3;
}
