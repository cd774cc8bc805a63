package org.processverify.engine.formula.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ActorSymbol(
        @JsonProperty("actor_name") String actorName,
        @JsonProperty("symbol") String symbol
) {
}
