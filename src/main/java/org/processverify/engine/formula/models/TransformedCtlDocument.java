package org.processverify.engine.formula.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Content of transformed_ctl_output.json.
 *
 * @param substitutions          task symbol to place expression
 * @param transformedConstraints the rewritten constraints in input order
 */
public record TransformedCtlDocument(
        @JsonProperty("substitutions") Map<String, String> substitutions,
        @JsonProperty("transformed_constraints") List<TransformedConstraint> transformedConstraints
) {
}
