package org.processverify.engine.closure.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.processverify.engine.bpmn.models.GatewayType;

import java.util.List;
import java.util.Optional;

/**
 * A gateway placed between task symbols. Inputs and outputs may name other gateways.
 *
 * @param gatewaySymbol identifier, e.g. "G1"
 * @param gatewayType   routing type as written in the document ("Exclusive", "Parallel", ...)
 * @param fromTasks     ordered input symbols
 * @param toTasks       ordered output symbols
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewaySpec(
        @JsonProperty("gateway_symbol") String gatewaySymbol,
        @JsonProperty("gateway_type") String gatewayType,
        @JsonProperty("from_tasks") List<String> fromTasks,
        @JsonProperty("to_tasks") List<String> toTasks
) {
    public GatewaySpec {
        fromTasks = fromTasks == null ? List.of() : List.copyOf(fromTasks);
        toTasks = toTasks == null ? List.of() : List.copyOf(toTasks);
    }

    /**
     * The routing type, empty when the document names none or an unknown one.
     */
    public Optional<GatewayType> routingType() {
        if (gatewayType == null || gatewayType.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(GatewayType.from(gatewayType));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
