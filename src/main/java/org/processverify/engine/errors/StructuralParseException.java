package org.processverify.engine.errors;

/**
 * Raised when a BPMN or PNML document cannot be read into the engine's model.
 */
public class StructuralParseException extends GraphEngineException {

    public StructuralParseException(String message, String identifier, Stage stage) {
        super(message, identifier, stage);
    }

    public StructuralParseException(String message, String identifier, Stage stage, Throwable cause) {
        super(message, identifier, stage, cause);
    }
}
