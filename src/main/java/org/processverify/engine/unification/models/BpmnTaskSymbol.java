package org.processverify.engine.unification.models;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named task of a diagram, offered to symbol matching.
 *
 * @param type BPMN element name, e.g. "userTask"
 */
public record BpmnTaskSymbol(
        @JsonProperty("id") String id,
        @JsonProperty("desc") String desc,
        @JsonProperty("type") String type
) {
}
