package org.processverify.engine.unification.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.processverify.engine.bpmn.models.Actor;

import java.util.List;

public record BpmnSymbols(
        @JsonProperty("actor") List<Actor> actors,
        @JsonProperty("tasks") List<BpmnTaskSymbol> tasks
) {
}
