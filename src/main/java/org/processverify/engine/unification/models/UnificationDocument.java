package org.processverify.engine.unification.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Symbol mappings between a benchmark and a target diagram, as produced by the matching step.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UnificationDocument(
        @JsonProperty("actor_mappings") List<SymbolMapping> actorMappings,
        @JsonProperty("task_mappings") List<SymbolMapping> taskMappings,
        @JsonProperty("reasoning") String reasoning,
        @JsonProperty("quality_metrics") MappingQuality qualityMetrics
) {
    public UnificationDocument {
        actorMappings = actorMappings == null ? List.of() : List.copyOf(actorMappings);
        taskMappings = taskMappings == null ? List.of() : List.copyOf(taskMappings);
    }
}
