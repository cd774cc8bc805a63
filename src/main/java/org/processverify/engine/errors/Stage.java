package org.processverify.engine.errors;

/**
 * Pipeline stage in which an engine failure was raised.
 */
public enum Stage {
    PARSE,
    GENERATION,
    CLOSURE,
    TRANSLATION,
    SIMILARITY,
    SUBSTITUTION,
    CONFIG
}
