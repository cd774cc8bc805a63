package org.processverify.engine.closure.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A position in the control flow where a gateway is likely needed.
 * Convergent pairs fill {@code fromTasks} and {@code toTask}; divergent pairs fill
 * {@code fromTask} and {@code toTasks}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BranchPair(
        @JsonProperty("type") BranchType type,
        @JsonProperty("from_tasks") List<String> fromTasks,
        @JsonProperty("to_task") String toTask,
        @JsonProperty("from_task") String fromTask,
        @JsonProperty("to_tasks") List<String> toTasks
) {
    public static BranchPair convergent(List<String> fromTasks, String toTask) {
        return new BranchPair(BranchType.CONVERGENT, List.copyOf(fromTasks), toTask, null, null);
    }

    public static BranchPair divergent(String fromTask, List<String> toTasks) {
        return new BranchPair(BranchType.DIVERGENT, null, null, fromTask, List.copyOf(toTasks));
    }
}
