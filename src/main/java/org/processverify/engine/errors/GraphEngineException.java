package org.processverify.engine.errors;

/**
 * Base type of every failure raised by the structural graph engine.
 * Carries the offending identifier (node, transition, symbol or file) and the stage,
 * so a failure can be reproduced offline from the message alone.
 */
public class GraphEngineException extends RuntimeException {
    private final String identifier;
    private final Stage stage;

    public GraphEngineException(String message, String identifier, Stage stage) {
        super(format(message, identifier, stage));
        this.identifier = identifier;
        this.stage = stage;
    }

    public GraphEngineException(String message, String identifier, Stage stage, Throwable cause) {
        super(format(message, identifier, stage), cause);
        this.identifier = identifier;
        this.stage = stage;
    }

    public String getIdentifier() {
        return identifier;
    }

    public Stage getStage() {
        return stage;
    }

    private static String format(String message, String identifier, Stage stage) {
        return String.format("[%s] %s (identifier: '%s')", stage, message, identifier);
    }
}
