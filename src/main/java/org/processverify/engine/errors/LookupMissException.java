package org.processverify.engine.errors;

/**
 * Raised when a referenced node, transition or symbol is absent and the caller
 * cannot continue without it.
 */
public class LookupMissException extends GraphEngineException {

    public LookupMissException(String message, String identifier, Stage stage) {
        super(message, identifier, stage);
    }
}
