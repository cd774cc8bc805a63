package org.processverify.engine.formula.models;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A constraint next to its rewrite over Petri-net places.
 */
public record TransformedConstraint(
        @JsonProperty("constraint_id") String constraintId,
        @JsonProperty("ctl_formula") String ctlFormula,
        @JsonProperty("transformed_formula") String transformedFormula
) {
}
