package org.processverify.engine.formula.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ConstraintType {
    SAFETY_PROPERTIES("safety_properties"),
    LIVENESS_PROPERTIES("liveness_properties"),
    RESPONSE_PROPERTIES("response_properties"),
    PRECEDENCE_PROPERTIES("precedence_properties");

    private final String label;

    ConstraintType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<ConstraintType> fromLabel(String label) {
        return Arrays.stream(values())
                .filter(type -> type.label.equals(label))
                .findFirst();
    }
}
