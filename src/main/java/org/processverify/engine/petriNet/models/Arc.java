package org.processverify.engine.petriNet.models;

/**
 * A directed arc. Translated nets also contain place-to-place arcs for sequence flows.
 */
public record Arc(String source, String target) {
}
