package org.processverify.engine.errors;

/**
 * Raised when an operation receives a diagram type it is not defined for,
 * e.g. a collaboration handed to the distance-matrix comparator.
 */
public class DiagramTypeException extends GraphEngineException {

    public DiagramTypeException(String message, String identifier, Stage stage) {
        super(message, identifier, stage);
    }
}
