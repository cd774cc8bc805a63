package org.processverify.engine.formula.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Content of symbol_output.json: actors ("A1", ...) and the tasks they perform ("T1", ...).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SymbolTable(
        @JsonProperty("actor") List<ActorSymbol> actors,
        @JsonProperty("tasks") List<TaskSymbol> tasks
) {
    public SymbolTable {
        actors = actors == null ? List.of() : List.copyOf(actors);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }
}
