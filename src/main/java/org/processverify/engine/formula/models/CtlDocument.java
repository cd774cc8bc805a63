package org.processverify.engine.formula.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Content of ctl_output.json and standard_ctl_constraints.json. Only the standard file has metadata.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CtlDocument(
        @JsonProperty("metadata") CtlMetadata metadata,
        @JsonProperty("ctl_constraints") List<CtlConstraint> ctlConstraints
) {
    public CtlDocument {
        ctlConstraints = ctlConstraints == null ? List.of() : List.copyOf(ctlConstraints);
    }
}
