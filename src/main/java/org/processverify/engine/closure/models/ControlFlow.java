package org.processverify.engine.closure.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line item of a control-flow document: a directed flow between two task or gateway symbols.
 *
 * @param from  source symbol, e.g. "T1" or "G1"
 * @param to    target symbol
 * @param actor symbol of the actor performing the flow, or the routing marker for synthesized gateway flows
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ControlFlow(
        @JsonProperty("from") String from,
        @JsonProperty("to") String to,
        @JsonProperty("actor") String actor
) {
    public boolean connects(String source, String target) {
        return from != null && to != null && from.equals(source) && to.equals(target);
    }

    public String key() {
        return from + "->" + to;
    }
}
