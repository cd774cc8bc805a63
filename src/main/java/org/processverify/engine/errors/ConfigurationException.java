package org.processverify.engine.errors;

public class ConfigurationException extends GraphEngineException {

    public ConfigurationException(String message, String identifier) {
        super(message, identifier, Stage.CONFIG);
    }

    public ConfigurationException(String message, String identifier, Throwable cause) {
        super(message, identifier, Stage.CONFIG, cause);
    }
}
