package org.processverify.engine.closure.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Content of seq_output.json: the author-asserted control flows and message flows.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SequenceDocument(
        @JsonProperty("control_flow") List<ControlFlow> controlFlow,
        @JsonProperty("message_flow") List<ControlFlow> messageFlow
) {
    public SequenceDocument {
        controlFlow = controlFlow == null ? List.of() : List.copyOf(controlFlow);
        messageFlow = messageFlow == null ? List.of() : List.copyOf(messageFlow);
    }
}
