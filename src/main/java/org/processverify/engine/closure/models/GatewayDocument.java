package org.processverify.engine.closure.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Content of gate_output.json.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayDocument(
        @JsonProperty("gateways") List<GatewaySpec> gateways
) {
    public GatewayDocument {
        gateways = gateways == null ? List.of() : List.copyOf(gateways);
    }
}
