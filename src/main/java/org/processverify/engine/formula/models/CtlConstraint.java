package org.processverify.engine.formula.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A CTL property over task symbols, e.g. {@code AG(T1 -> AF T2)}.
 * The constraint type is kept as text, since generated documents may carry unknown values.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CtlConstraint(
        @JsonProperty("constraint_id") String constraintId,
        @JsonProperty("ctl_formula") String ctlFormula,
        @JsonProperty("description") String description,
        @JsonProperty("requirement_reference") String requirementReference,
        @JsonProperty("constraint_type") String constraintType
) {
    public CtlConstraint withFormula(String formula) {
        return new CtlConstraint(constraintId, formula, description, requirementReference, constraintType);
    }
}
