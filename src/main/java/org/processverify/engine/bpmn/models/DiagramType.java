package org.processverify.engine.bpmn.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of BPMN diagram. A document containing a {@code collaboration} element is a
 * collaboration, anything else is treated as a single process diagram.
 */
public enum DiagramType {
    PROCESS("process"),
    COLLABORATION("collaboration");

    private final String label;

    DiagramType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
