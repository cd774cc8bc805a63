package org.processverify.engine.closure.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Content of updated_flow_output.json: the closure input next to its result.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UpdatedFlowReport(
        @JsonProperty("original_control_flow") List<ControlFlow> originalControlFlow,
        @JsonProperty("gateways") List<GatewaySpec> gateways,
        @JsonProperty("updated_control_flow") List<ControlFlow> updatedControlFlow
) {
}
