package org.processverify.engine.unification.models;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MappingQuality(
        @JsonProperty("total_actor_mappings") int totalActorMappings,
        @JsonProperty("high_confidence_actor_mappings") int highConfidenceActorMappings,
        @JsonProperty("total_task_mappings") int totalTaskMappings,
        @JsonProperty("high_confidence_task_mappings") int highConfidenceTaskMappings,
        @JsonProperty("actor_mapping_quality") double actorMappingQuality,
        @JsonProperty("task_mapping_quality") double taskMappingQuality
) {
}
