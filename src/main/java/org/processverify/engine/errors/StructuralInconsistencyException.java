package org.processverify.engine.errors;

import java.util.List;

/**
 * Raised when gateway nesting forms a cycle. The cycle path is kept for diagnostics.
 */
public class StructuralInconsistencyException extends GraphEngineException {
    private final List<String> cycle;

    public StructuralInconsistencyException(String message, String identifier, List<String> cycle) {
        super(message + ": " + String.join(" -> ", cycle), identifier, Stage.CLOSURE);
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
