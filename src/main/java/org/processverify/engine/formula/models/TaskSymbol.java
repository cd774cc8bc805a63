package org.processverify.engine.formula.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskSymbol(
        @JsonProperty("actor_symbol") String actorSymbol,
        @JsonProperty("task_description") String taskDescription,
        @JsonProperty("task_symbol") String taskSymbol
) {
}
