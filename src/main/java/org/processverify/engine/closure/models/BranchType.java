package org.processverify.engine.closure.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BranchType {
    /** Several sources flow into one target. */
    CONVERGENT("convergent"),
    /** One source flows into several targets. */
    DIVERGENT("divergent");

    private final String label;

    BranchType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
